package db.tagged.error;

/** Row conversion found a value whose kind the destination column does not hold. */
public class TypeMismatchException extends ValueConversionException {
    public TypeMismatchException(String message) {
        super(message);
    }
}
