package db.tagged.catalog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import db.tagged.error.DuplicateNameException;
import db.tagged.error.DuplicateTagException;

/**
 * Ordered set of columns indexed by tag and by name. Declared order is the canonical
 * positional order for ordinal (SQL) rows. Immutable; alterations return new collections.
 */
public final class ColumnCollection implements Iterable<Column> {
    private final List<Column> columns;
    private final List<Long> tags;
    private final Map<Long, Column> byTag;
    private final Map<String, Column> byName;
    private final Map<Long, Integer> positions;

    /** Visitor for {@link #iterate}; return true to stop early. */
    @FunctionalInterface
    public interface ColumnVisitor { boolean visit(Column column); }

    private ColumnCollection(List<Column> cols) {
        Map<Long, Column> tagIdx = new HashMap<>();
        Map<String, Column> nameIdx = new HashMap<>();
        Map<Long, Integer> posIdx = new HashMap<>();
        List<Long> tagList = new ArrayList<>(cols.size());
        for (int i = 0; i < cols.size(); i++) {
            Column c = cols.get(i);
            Column clash = tagIdx.putIfAbsent(c.tag(), c);
            if (clash != null) throw new DuplicateTagException(c.tag(), clash.name(), c.name());
            if (nameIdx.putIfAbsent(c.name(), c) != null) throw new DuplicateNameException(c.name());
            posIdx.put(c.tag(), i);
            tagList.add(c.tag());
        }
        this.columns = List.copyOf(cols);
        this.tags = Collections.unmodifiableList(tagList);
        this.byTag = tagIdx;
        this.byName = nameIdx;
        this.positions = posIdx;
    }

    public static ColumnCollection of(Column... cols) {
        return new ColumnCollection(List.of(cols));
    }

    public static ColumnCollection of(List<Column> cols) {
        if (cols == null) throw new IllegalArgumentException("columns must not be null");
        return new ColumnCollection(cols);
    }

    public int size() { return columns.size(); }

    public boolean isEmpty() { return columns.isEmpty(); }

    public List<Column> columns() { return columns; }

    /** Tags in declared order. */
    public List<Long> tags() { return tags; }

    public Optional<Column> byTag(long tag) { return Optional.ofNullable(byTag.get(tag)); }

    public Optional<Column> byName(String name) { return Optional.ofNullable(byName.get(name)); }

    public boolean containsTag(long tag) { return byTag.containsKey(tag); }

    /** Ordinal position of the tag, or -1 when absent. */
    public int position(long tag) {
        Integer p = positions.get(tag);
        return p == null ? -1 : p;
    }

    /**
     * Walks the columns in declared order.
     * @return true if the visitor stopped the walk early
     */
    public boolean iterate(ColumnVisitor visitor) {
        for (Column c : columns) {
            if (visitor.visit(c)) return true;
        }
        return false;
    }

    @Override
    public Iterator<Column> iterator() { return columns.iterator(); }

    public ColumnCollection append(Column... added) {
        List<Column> out = new ArrayList<>(columns);
        Collections.addAll(out, added);
        return new ColumnCollection(out);
    }

    public ColumnCollection without(long tag) {
        List<Column> out = new ArrayList<>(columns.size());
        for (Column c : columns) {
            if (c.tag() != tag) out.add(c);
        }
        return new ColumnCollection(out);
    }

    /** Swaps in a new definition for the column with the same tag, keeping its position. */
    public ColumnCollection replace(Column altered) {
        int pos = position(altered.tag());
        if (pos < 0) throw new IllegalArgumentException("No column with tag " + Long.toUnsignedString(altered.tag()));
        List<Column> out = new ArrayList<>(columns);
        out.set(pos, altered);
        return new ColumnCollection(out);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ColumnCollection other && columns.equals(other.columns);
    }

    @Override
    public int hashCode() { return columns.hashCode(); }

    @Override
    public String toString() { return columns.toString(); }
}
