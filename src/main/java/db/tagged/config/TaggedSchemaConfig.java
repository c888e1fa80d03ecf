package db.tagged.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * Settings for tag allocation and row export.
 * Read from tagged-schema.properties on the classpath when present, defaults otherwise.
 */
public class TaggedSchemaConfig {
    public static final String RESOURCE = "tagged-schema.properties";

    public static final String FIRST_TAG = "tags.first";
    public static final String RESERVED_TAG_MIN = "tags.reserved-min";
    public static final String BUFFER_SIZE = "export.buffer-size";
    public static final String ROWS_FIELD = "export.rows-field";

    public static final long DEFAULT_RESERVED_TAG_MIN = 1L << 50;
    public static final int DEFAULT_BUFFER_SIZE = 256 * 1024;

    public final long firstTag;
    public final long reservedTagMin; // tags at or above this are never allocated to user columns
    public final int writeBufferSize;
    public final String rowsFieldName;

    public TaggedSchemaConfig(long firstTag, long reservedTagMin, int writeBufferSize, String rowsFieldName) {
        if (Long.compareUnsigned(firstTag, reservedTagMin) >= 0) {
            throw new IllegalArgumentException("First tag " + Long.toUnsignedString(firstTag) + " must be below reserved range " + Long.toUnsignedString(reservedTagMin));
        }
        if (writeBufferSize <= 0) throw new IllegalArgumentException("Write buffer size must be positive: " + writeBufferSize);
        if (rowsFieldName == null || rowsFieldName.isBlank()) throw new IllegalArgumentException("Rows field name required");
        this.firstTag = firstTag;
        this.reservedTagMin = reservedTagMin;
        this.writeBufferSize = writeBufferSize;
        this.rowsFieldName = rowsFieldName;
    }

    public static TaggedSchemaConfig defaultConfig() {
        return new TaggedSchemaConfig(0L, DEFAULT_RESERVED_TAG_MIN, DEFAULT_BUFFER_SIZE, "rows");
    }

    public static TaggedSchemaConfig fromProperties(Properties props) {
        TaggedSchemaConfig d = defaultConfig();
        return new TaggedSchemaConfig(
            parseUnsigned(props, FIRST_TAG, d.firstTag),
            parseUnsigned(props, RESERVED_TAG_MIN, d.reservedTagMin),
            parseInt(props, BUFFER_SIZE, d.writeBufferSize),
            props.getProperty(ROWS_FIELD, d.rowsFieldName).trim()
        );
    }

    public static TaggedSchemaConfig load() {
        try (InputStream in = TaggedSchemaConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) return defaultConfig();
            Properties props = new Properties();
            props.load(in);
            return fromProperties(props);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed reading " + RESOURCE, e);
        }
    }

    private static long parseUnsigned(Properties props, String key, long fallback) {
        String raw = props.getProperty(key);
        if (raw == null) return fallback;
        try {
            return Long.parseUnsignedLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + raw, e);
        }
    }

    private static int parseInt(Properties props, String key, int fallback) {
        String raw = props.getProperty(key);
        if (raw == null) return fallback;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + raw, e);
        }
    }
}
