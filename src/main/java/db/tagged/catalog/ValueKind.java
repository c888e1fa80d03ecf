package db.tagged.catalog;

/**
 * Logical kinds a stored value can have. The payload class is the Java type
 * a {@link StoredValue} of that kind carries.
 */
public enum ValueKind {
    INT(Long.class),
    UINT(Long.class), // unsigned 64-bit, payload holds the raw bits
    FLOAT(Double.class),
    STRING(String.class),
    BOOL(Boolean.class),
    UUID(java.util.UUID.class);

    private final Class<?> payloadType;

    ValueKind(Class<?> payloadType) {
        this.payloadType = payloadType;
    }

    public Class<?> payloadType() { return payloadType; }

    public boolean isIntegral() { return this == INT || this == UINT; }
}
