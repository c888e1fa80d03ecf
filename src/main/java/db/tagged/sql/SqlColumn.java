package db.tagged.sql;

/**
 * Column as the query engine describes it: ordinal, tag-free.
 * source: owning table name, empty for result columns.
 * extra: auxiliary annotation, carries "tag:&lt;uint64&gt;" when exported from a tagged schema.
 */
public record SqlColumn(String name,
                        SqlType type,
                        boolean nullable,
                        boolean primaryKey,
                        String defaultExpression,
                        boolean autoIncrement,
                        String comment,
                        String source,
                        String extra) {

    public SqlColumn {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("Column name required");
        if (type == null) throw new IllegalArgumentException("Column type required for '" + name + "'");
        comment = comment == null ? "" : comment;
        source = source == null ? "" : source;
        extra = extra == null ? "" : extra;
    }

    public static SqlColumn of(String name, SqlType type, boolean nullable, boolean primaryKey) {
        return new SqlColumn(name, type, nullable, primaryKey, null, false, "", "", "");
    }

    public SqlColumn withExtra(String newExtra) {
        return new SqlColumn(name, type, nullable, primaryKey, defaultExpression, autoIncrement, comment, source, newExtra);
    }

    public SqlColumn withDefault(String expression) {
        return new SqlColumn(name, type, nullable, primaryKey, expression, autoIncrement, comment, source, extra);
    }

    public SqlColumn withAutoIncrement(boolean autoInc) {
        return new SqlColumn(name, type, nullable, primaryKey, defaultExpression, autoInc, comment, source, extra);
    }

    public SqlColumn withComment(String text) {
        return new SqlColumn(name, type, nullable, primaryKey, defaultExpression, autoIncrement, text, source, extra);
    }
}
