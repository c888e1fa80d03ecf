package db.tagged.error;

/** A non-nullable column received no value. */
public class NonNullableColumnException extends SchemaException {
    private final String columnName;

    public NonNullableColumnException(String columnName) {
        super("Column '" + columnName + "' received null but is non-nullable");
        this.columnName = columnName;
    }

    public String columnName() { return columnName; }
}
