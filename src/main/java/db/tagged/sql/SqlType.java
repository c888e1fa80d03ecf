package db.tagged.sql;

import db.tagged.catalog.TypeDescriptor;
import db.tagged.catalog.ValueKind;

/**
 * Type identifiers used by the query engine. Several SQL types share one logical type;
 * each logical type exports a canonical SQL type.
 */
public enum SqlType {
    TINYINT("TINYINT", TypeDescriptor.INT),
    SMALLINT("SMALLINT", TypeDescriptor.INT),
    INT("INT", TypeDescriptor.INT),
    BIGINT("BIGINT", TypeDescriptor.INT),
    BIGINT_UNSIGNED("BIGINT UNSIGNED", TypeDescriptor.UINT),
    FLOAT("FLOAT", TypeDescriptor.FLOAT),
    DOUBLE("DOUBLE", TypeDescriptor.FLOAT),
    VARCHAR("VARCHAR", TypeDescriptor.STRING),
    TEXT("TEXT", TypeDescriptor.STRING),
    BOOLEAN("BOOLEAN", TypeDescriptor.BOOL),
    UUID("UUID", TypeDescriptor.UUID);

    private final String sqlName;
    private final TypeDescriptor descriptor;

    SqlType(String sqlName, TypeDescriptor descriptor) {
        this.sqlName = sqlName;
        this.descriptor = descriptor;
    }

    public String sqlName() { return sqlName; }

    /** Logical type a column of this SQL type is stored as. */
    public TypeDescriptor descriptor() { return descriptor; }

    /** SQL type a logical type is exported as. */
    public static SqlType canonical(TypeDescriptor descriptor) {
        ValueKind kind = descriptor.kind();
        return switch (kind) {
            case INT -> BIGINT;
            case UINT -> BIGINT_UNSIGNED;
            case FLOAT -> DOUBLE;
            case STRING -> TEXT;
            case BOOL -> BOOLEAN;
            case UUID -> UUID;
        };
    }

    public static SqlType fromSqlName(String name) {
        if (name == null) throw new IllegalArgumentException("SQL type name required");
        String normalized = name.trim().replaceAll("\\s+", " ");
        for (SqlType t : values()) {
            if (t.sqlName.equalsIgnoreCase(normalized)) return t;
        }
        throw new IllegalArgumentException("Unsupported SQL type: " + name);
    }

    @Override
    public String toString() { return sqlName; }
}
