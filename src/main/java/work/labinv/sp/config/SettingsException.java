package work.labinv.sp.config;

import work.labinv.sp.field.SetupParamException;

public final class SettingsException extends SetupParamException {
    public SettingsException(String message) {
        super("settings_invalid", message);
    }

    public SettingsException(String message, Throwable cause) {
        super("settings_invalid", message, cause);
    }
}
