package work.labinv.sp.field;

/**
 * Raised while building a {@link FieldCatalog} (duplicate key, dangling or cyclic dependency, missing formula).
 */
public final class CatalogException extends SetupParamException {
    public CatalogException(String message) {
        super("catalog_invalid", message);
    }
}
