package db.tagged.catalog;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable column definition. The tag is the column's permanent identity: renaming,
 * retyping or changing nullability produces a new Column carrying the same tag.
 * defaultExpression: raw SQL default text, null when the column has none.
 */
public record Column(long tag,
                     String name,
                     TypeDescriptor type,
                     boolean partOfPrimaryKey,
                     String defaultExpression,
                     boolean autoIncrement,
                     String comment,
                     Set<ColumnConstraint> constraints) {

    public Column {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("Column name required");
        Objects.requireNonNull(type, "type");
        comment = comment == null ? "" : comment;
        constraints = constraints == null || constraints.isEmpty()
            ? Set.of()
            : Set.copyOf(EnumSet.copyOf(constraints));
    }

    public static Column of(String name, long tag, TypeDescriptor type, boolean partOfPrimaryKey, ColumnConstraint... constraints) {
        return new Column(tag, name, type, partOfPrimaryKey, null, false, "", constraints.length == 0 ? Set.of() : EnumSet.copyOf(Arrays.asList(constraints)));
    }

    public boolean nullable() { return !constraints.contains(ColumnConstraint.NOT_NULL); }

    public Column withName(String newName) {
        return new Column(tag, newName, type, partOfPrimaryKey, defaultExpression, autoIncrement, comment, constraints);
    }

    public Column withType(TypeDescriptor newType) {
        return new Column(tag, name, newType, partOfPrimaryKey, defaultExpression, autoIncrement, comment, constraints);
    }

    public Column withNullable(boolean isNullable) {
        EnumSet<ColumnConstraint> cs = constraints.isEmpty() ? EnumSet.noneOf(ColumnConstraint.class) : EnumSet.copyOf(constraints);
        if (isNullable) cs.remove(ColumnConstraint.NOT_NULL);
        else cs.add(ColumnConstraint.NOT_NULL);
        return new Column(tag, name, type, partOfPrimaryKey, defaultExpression, autoIncrement, comment, cs);
    }

    public Column withPrimaryKey(boolean pk) {
        return new Column(tag, name, type, pk, defaultExpression, autoIncrement, comment, constraints);
    }

    @Override
    public String toString() {
        return name + "(tag=" + Long.toUnsignedString(tag) + ", " + type
            + (partOfPrimaryKey ? ", pk" : "")
            + (nullable() ? "" : ", not null")
            + (autoIncrement ? ", auto_increment" : "") + ")";
    }
}
