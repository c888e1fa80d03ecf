package db.tagged.sql;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.OptionalLong;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import db.tagged.catalog.Column;
import db.tagged.catalog.ColumnCollection;
import db.tagged.catalog.ColumnConstraint;
import db.tagged.catalog.Schema;
import db.tagged.tags.TagAllocator;
import db.tagged.tags.TagHistorySource;

/**
 * Converts column lists between the engine's description and tagged schemas.
 * Table schemas get tags from the allocator against the table's history; exported columns
 * carry their tag in the extra field so a re-import recovers tag identity.
 */
public class SqlSchemaConverter {
    private static final Logger LOG = LoggerFactory.getLogger(SqlSchemaConverter.class);

    private final TagHistorySource history;
    private final TagAllocator allocator;

    public SqlSchemaConverter(TagHistorySource history, TagAllocator allocator) {
        if (history == null || allocator == null) throw new IllegalArgumentException("history and allocator required");
        this.history = history;
        this.allocator = allocator;
    }

    public SqlSchemaConverter(TagHistorySource history) {
        this(history, new TagAllocator());
    }

    /**
     * Schema for creating a table. Columns annotated with a tag keep it; the rest are
     * allocated fresh tags that avoid both the table's history and the annotated tags.
     */
    public Schema toTableSchema(String tableName, List<SqlColumn> sqlColumns) {
        if (sqlColumns == null || sqlColumns.isEmpty()) throw new IllegalArgumentException("Table '" + tableName + "' needs at least one column");

        Set<Long> reserved = new HashSet<>(history.tagHistory(tableName));
        Schema schema = Schema.of(ColumnCollection.of(tagColumns(tableName, reserved, sqlColumns)));
        schema.validateForInsert();
        return schema;
    }

    /**
     * New schema with the added columns appended. Annotated columns keep their tag, the rest
     * are tagged against the table's history and the current columns.
     */
    public Schema addColumns(String tableName, Schema current, List<SqlColumn> added) {
        if (added == null || added.isEmpty()) return current;
        Set<Long> reserved = new HashSet<>(history.tagHistory(tableName));
        reserved.addAll(current.allColumns().tags());

        List<Column> newCols = tagColumns(tableName, reserved, added);
        ColumnCollection altered = current.allColumns().append(newCols.toArray(new Column[0]));
        return current.isUnkeyed() ? Schema.unkeyed(altered) : Schema.of(altered);
    }

    // reserved is extended with the annotated tags before allocating
    private List<Column> tagColumns(String tableName, Set<Long> reserved, List<SqlColumn> sqlColumns) {
        List<OptionalLong> annotated = new ArrayList<>(sqlColumns.size());
        List<String> needTags = new ArrayList<>();
        for (SqlColumn col : sqlColumns) {
            OptionalLong tag = TagAnnotation.parse(col.extra());
            annotated.add(tag);
            if (tag.isPresent()) reserved.add(tag.getAsLong());
            else needTags.add(col.name());
        }

        List<Long> tags = allocator.allocate(reserved, needTags);
        if (tags.size() != needTags.size()) {
            throw new IllegalStateException("Number of tags should equal number of columns: " + tags.size() + " vs " + needTags.size());
        }

        List<Column> cols = new ArrayList<>(sqlColumns.size());
        int next = 0;
        for (int i = 0; i < sqlColumns.size(); i++) {
            OptionalLong tag = annotated.get(i);
            long t = tag.isPresent() ? tag.getAsLong() : tags.get(next++);
            cols.add(toColumn(t, sqlColumns.get(i)));
        }
        LOG.debug("Tagged {} columns for table '{}', {} newly allocated", cols.size(), tableName, needTags.size());
        return cols;
    }

    /**
     * Unkeyed schema for a result set. Tags come from the annotation when present,
     * otherwise from the column's ordinal position.
     */
    public static Schema toResultSchema(List<SqlColumn> sqlColumns) {
        List<Column> cols = new ArrayList<>(sqlColumns.size());
        for (int i = 0; i < sqlColumns.size(); i++) {
            SqlColumn c = sqlColumns.get(i);
            long tag = TagAnnotation.parse(c.extra()).orElse(i);
            cols.add(toColumn(tag, c));
        }
        return Schema.unkeyed(ColumnCollection.of(cols));
    }

    /** Engine view of a schema, one column per schema column in declared order. */
    public static List<SqlColumn> fromSchema(String tableName, Schema schema) {
        List<SqlColumn> out = new ArrayList<>(schema.size());
        for (Column col : schema.allColumns()) {
            out.add(new SqlColumn(
                col.name(),
                SqlType.canonical(col.type()),
                col.nullable(),
                col.partOfPrimaryKey(),
                col.defaultExpression(),
                col.autoIncrement(),
                col.comment(),
                tableName,
                TagAnnotation.format(col.tag())
            ));
        }
        return out;
    }

    public static Column toColumn(long tag, SqlColumn col) {
        Set<ColumnConstraint> constraints = col.nullable() ? Set.of() : Set.of(ColumnConstraint.NOT_NULL);
        return new Column(tag, col.name(), col.type().descriptor(), col.primaryKey(),
            col.defaultExpression(), col.autoIncrement(), col.comment(), constraints);
    }
}
