package work.labinv.sp.field;

/**
 * Base class for setup-parameter errors; carries a stable machine-readable code next to the message.
 */
public class SetupParamException extends RuntimeException {
    private final String code;

    public SetupParamException(String code, String message) {
        super(message);
        this.code = code;
    }

    public SetupParamException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() {
        return code;
    }
}
