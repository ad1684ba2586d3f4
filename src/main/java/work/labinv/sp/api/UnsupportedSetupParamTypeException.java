package work.labinv.sp.api;

import work.labinv.sp.field.SetupParamException;

/**
 * The requested setup-parameter type has no implementation. {@link #placeholder()} tells a declared but not yet
 * implemented type apart from a name nobody knows.
 */
public final class UnsupportedSetupParamTypeException extends SetupParamException {
    private final String typeName;
    private final boolean placeholder;

    public UnsupportedSetupParamTypeException(String typeName, boolean placeholder) {
        super(
            "unsupported_sp_type",
            placeholder
                ? "Setup parameter type " + typeName + " is not supported yet"
                : "Unknown setup parameter type: " + typeName
        );
        this.typeName = typeName;
        this.placeholder = placeholder;
    }

    public String typeName() {
        return typeName;
    }

    public boolean placeholder() {
        return placeholder;
    }
}
