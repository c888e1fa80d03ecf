package db.tagged.catalog;

import java.math.BigInteger;
import java.util.EnumMap;
import java.util.Map;

import db.tagged.error.ValueConversionException;

/**
 * Logical column type. Converts between the internal {@link StoredValue} form and the
 * external scalars handed to and received from the query engine.
 * One shared instance exists per {@link ValueKind}; instances are immutable.
 *
 * External scalars by kind:
 *   INT    Byte, Short, Integer, Long, BigInteger (in range)  -> Long
 *   UINT   non-negative integral, BigInteger in [0, 2^64)     -> BigInteger
 *   FLOAT  Float, Double                                      -> Double
 *   STRING any CharSequence                                   -> String
 *   BOOL   Boolean                                            -> Boolean
 *   UUID   java.util.UUID                                     -> UUID
 * Anything else is rejected; there is no cross-kind coercion.
 */
public final class TypeDescriptor {
    public static final TypeDescriptor INT = new TypeDescriptor(ValueKind.INT);
    public static final TypeDescriptor UINT = new TypeDescriptor(ValueKind.UINT);
    public static final TypeDescriptor FLOAT = new TypeDescriptor(ValueKind.FLOAT);
    public static final TypeDescriptor STRING = new TypeDescriptor(ValueKind.STRING);
    public static final TypeDescriptor BOOL = new TypeDescriptor(ValueKind.BOOL);
    public static final TypeDescriptor UUID = new TypeDescriptor(ValueKind.UUID);

    private static final Map<ValueKind, TypeDescriptor> BY_KIND = new EnumMap<>(ValueKind.class);
    static {
        for (TypeDescriptor td : new TypeDescriptor[] { INT, UINT, FLOAT, STRING, BOOL, UUID }) {
            BY_KIND.put(td.kind, td);
        }
    }

    private static final BigInteger UINT_LIMIT = BigInteger.ONE.shiftLeft(64);

    private final ValueKind kind;

    private TypeDescriptor(ValueKind kind) {
        this.kind = kind;
    }

    public static TypeDescriptor forKind(ValueKind kind) {
        return BY_KIND.get(kind);
    }

    public ValueKind kind() { return kind; }

    public boolean accepts(StoredValue value) {
        return value != null && value.kind() == kind;
    }

    public Object toExternal(StoredValue value) {
        if (!accepts(value)) {
            throw new ValueConversionException("Cannot render " + describe(value) + " as " + kind);
        }
        if (kind == ValueKind.UINT) {
            return new BigInteger(Long.toUnsignedString((Long) value.payload()));
        }
        return value.payload();
    }

    public StoredValue fromExternal(Object scalar) {
        if (scalar == null) throw new IllegalArgumentException("External NULL has no stored form");
        switch (kind) {
            case INT -> {
                if (scalar instanceof Byte || scalar instanceof Short || scalar instanceof Integer || scalar instanceof Long) {
                    return StoredValue.ofInt(((Number) scalar).longValue());
                }
                if (scalar instanceof BigInteger big) {
                    try {
                        return StoredValue.ofInt(big.longValueExact());
                    } catch (ArithmeticException e) {
                        throw new ValueConversionException("Integer out of range: " + big, e);
                    }
                }
            }
            case UINT -> {
                if (scalar instanceof Byte || scalar instanceof Short || scalar instanceof Integer || scalar instanceof Long) {
                    long v = ((Number) scalar).longValue();
                    if (v < 0) throw new ValueConversionException("Negative value for unsigned column: " + v);
                    return StoredValue.ofUint(v);
                }
                if (scalar instanceof BigInteger big) {
                    if (big.signum() < 0 || big.compareTo(UINT_LIMIT) >= 0) {
                        throw new ValueConversionException("Unsigned value out of range: " + big);
                    }
                    return StoredValue.ofUint(big.longValue());
                }
            }
            case FLOAT -> {
                if (scalar instanceof Float || scalar instanceof Double) {
                    return StoredValue.ofFloat(((Number) scalar).doubleValue());
                }
            }
            case STRING -> {
                if (scalar instanceof CharSequence cs) return StoredValue.ofString(cs.toString());
            }
            case BOOL -> {
                if (scalar instanceof Boolean b) return StoredValue.ofBool(b);
            }
            case UUID -> {
                if (scalar instanceof java.util.UUID u) return StoredValue.ofUuid(u);
            }
        }
        throw new ValueConversionException("Cannot convert " + scalar.getClass().getSimpleName() + " '" + scalar + "' to " + kind);
    }

    private static String describe(StoredValue value) {
        return value == null ? "null" : value.kind() + " value " + value;
    }

    @Override
    public String toString() { return kind.name(); }
}
