package db.tagged.sql;

import java.util.OptionalLong;

import db.tagged.error.TagAnnotationException;

/**
 * Wire convention for carrying a column tag through the engine's column metadata:
 * {@code tag:<uint64>} in the column's extra field. Version 1 of the format.
 */
public final class TagAnnotation {
    public static final String PREFIX = "tag:";

    private TagAnnotation() {}

    public static String format(long tag) {
        return PREFIX + Long.toUnsignedString(tag);
    }

    /** Empty for a missing or blank annotation; a present but malformed one fails. */
    public static OptionalLong parse(String annotation) {
        if (annotation == null || annotation.isBlank()) return OptionalLong.empty();
        String s = annotation.trim();
        if (!s.startsWith(PREFIX)) {
            throw new TagAnnotationException("Malformed tag annotation, expected '" + PREFIX + "<uint64>': " + annotation);
        }
        try {
            return OptionalLong.of(Long.parseUnsignedLong(s.substring(PREFIX.length())));
        } catch (NumberFormatException e) {
            throw new TagAnnotationException("Malformed tag annotation, expected '" + PREFIX + "<uint64>': " + annotation, e);
        }
    }
}
