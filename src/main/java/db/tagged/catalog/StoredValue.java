package db.tagged.catalog;

import java.util.Objects;
import java.util.UUID;

/**
 * Internal storage form of a single non-null column value.
 * There is no null stored value: a missing tag in a row is the NULL representation.
 */
public record StoredValue(ValueKind kind, Object payload) {
    public StoredValue {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(payload, "payload");
        if (!kind.payloadType().isInstance(payload)) {
            throw new IllegalArgumentException("Payload " + payload.getClass().getSimpleName() + " does not fit kind " + kind);
        }
    }

    public static StoredValue ofInt(long v) { return new StoredValue(ValueKind.INT, v); }
    public static StoredValue ofUint(long bits) { return new StoredValue(ValueKind.UINT, bits); }
    public static StoredValue ofFloat(double v) { return new StoredValue(ValueKind.FLOAT, v); }
    public static StoredValue ofString(String v) { return new StoredValue(ValueKind.STRING, v); }
    public static StoredValue ofBool(boolean v) { return new StoredValue(ValueKind.BOOL, v); }
    public static StoredValue ofUuid(UUID v) { return new StoredValue(ValueKind.UUID, v); }

    @Override
    public String toString() {
        if (kind == ValueKind.UINT) return Long.toUnsignedString((Long) payload);
        if (kind == ValueKind.STRING) return "'" + payload + "'";
        return String.valueOf(payload);
    }
}
