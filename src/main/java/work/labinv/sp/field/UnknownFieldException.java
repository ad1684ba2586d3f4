package work.labinv.sp.field;

public final class UnknownFieldException extends SetupParamException {
    private final String key;

    public UnknownFieldException(String catalog, String key) {
        super("unknown_field", "Unknown field '" + key + "' in catalog " + catalog);
        this.key = key;
    }

    public String key() {
        return key;
    }
}
