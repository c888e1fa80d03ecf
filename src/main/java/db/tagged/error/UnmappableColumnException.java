package db.tagged.error;

/**
 * A column or tag could not be resolved: an explicit mapping names a tag missing from a schema,
 * a strict name mapping leaves source columns unmatched, or a projection names an unknown column.
 */
public class UnmappableColumnException extends SchemaException {
    public UnmappableColumnException(String message) {
        super(message);
    }
}
