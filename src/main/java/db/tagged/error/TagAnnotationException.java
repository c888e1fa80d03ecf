package db.tagged.error;

/** An external column carried a tag annotation that does not follow the {@code tag:<uint64>} convention. */
public class TagAnnotationException extends SchemaException {
    public TagAnnotationException(String message, Throwable cause) {
        super(message, cause);
    }

    public TagAnnotationException(String message) {
        super(message);
    }
}
