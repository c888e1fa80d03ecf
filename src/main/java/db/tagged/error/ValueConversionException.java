package db.tagged.error;

/** A stored value cannot be rendered as, or a scalar cannot be parsed into, a column's type. */
public class ValueConversionException extends SchemaException {
    public ValueConversionException(String message) {
        super(message);
    }

    public ValueConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
