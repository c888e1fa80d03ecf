package db.tagged.sql;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import db.tagged.catalog.Column;
import db.tagged.catalog.Schema;
import db.tagged.catalog.TestSchemas;
import db.tagged.catalog.TypeDescriptor;
import db.tagged.error.DuplicateTagException;
import db.tagged.error.SchemaValidationException;
import db.tagged.error.TagAnnotationException;
import db.tagged.tags.TestTagHistoryCatalog;

public class SqlSchemaConverterTest {
    private final TestTagHistoryCatalog catalog = new TestTagHistoryCatalog();
    private final SqlSchemaConverter converter = new SqlSchemaConverter(catalog);

    private static List<SqlColumn> peopleColumns() {
        return List.of(
            SqlColumn.of("id", SqlType.INT, false, true),
            SqlColumn.of("name", SqlType.VARCHAR, true, false).withComment("display name"),
            SqlColumn.of("score", SqlType.DOUBLE, true, false).withDefault("0.0")
        );
    }

    @Test
    void createdTableGetsFreshTags() {
        Schema s = converter.toTableSchema("people", peopleColumns());
        assertEquals(List.of(0L, 1L, 2L), s.allColumns().tags());
        Column name = s.columnNamed("name").orElseThrow();
        assertEquals(TypeDescriptor.STRING, name.type());
        assertEquals("display name", name.comment());
        assertEquals("0.0", s.columnNamed("score").orElseThrow().defaultExpression());
        assertFalse(s.columnNamed("id").orElseThrow().nullable());
    }

    @Test
    void recreatedTableNeverReusesHistoricTags() {
        catalog.recordSchema("people", TestSchemas.people());
        Schema s = converter.toTableSchema("people", peopleColumns());
        assertEquals(List.of(7L, 8L, 9L), s.allColumns().tags());
    }

    @Test
    void tableWithoutPrimaryKeyIsRejected() {
        List<SqlColumn> cols = List.of(SqlColumn.of("v", SqlType.INT, true, false));
        assertThrows(SchemaValidationException.class, () -> converter.toTableSchema("t", cols));
    }

    @Test
    void nullablePrimaryKeyIsRejected() {
        List<SqlColumn> cols = List.of(SqlColumn.of("id", SqlType.INT, true, true));
        assertThrows(SchemaValidationException.class, () -> converter.toTableSchema("t", cols));
    }

    @Test
    void exportCarriesTagAnnotation() {
        List<SqlColumn> exported = SqlSchemaConverter.fromSchema("people", TestSchemas.people());
        assertEquals(6, exported.size());
        SqlColumn rating = exported.get(5);
        assertEquals("rating", rating.name());
        assertEquals(SqlType.DOUBLE, rating.type());
        assertEquals("people", rating.source());
        assertEquals("tag:6", rating.extra());
        assertTrue(exported.get(0).primaryKey());
        assertFalse(exported.get(0).nullable());
    }

    @Test
    void exportThenImportPreservesTagIdentity() {
        Schema original = Schema.of(
            TestSchemas.people().columnNamed("id").orElseThrow(),
            Column.of("nick", 12, TypeDescriptor.STRING, false),
            Column.of("visits", 40, TypeDescriptor.UINT, false)
        );
        Schema imported = converter.toTableSchema("people", SqlSchemaConverter.fromSchema("people", original));
        assertEquals(original, imported);
    }

    @Test
    void annotatedAndFreshColumnsMix() {
        List<SqlColumn> cols = List.of(
            SqlColumn.of("id", SqlType.BIGINT, false, true).withExtra("tag:5"),
            SqlColumn.of("extra", SqlType.TEXT, true, false)
        );
        Schema s = converter.toTableSchema("t", cols);
        assertEquals(List.of(5L, 6L), s.allColumns().tags());
    }

    @Test
    void malformedAnnotationFailsCleanly() {
        List<SqlColumn> cols = List.of(SqlColumn.of("id", SqlType.INT, false, true).withExtra("tag:five"));
        assertThrows(TagAnnotationException.class, () -> converter.toTableSchema("t", cols));
    }

    @Test
    void addedColumnsAvoidDroppedTags() {
        Schema current = converter.toTableSchema("people", peopleColumns());
        catalog.recordSchema("people", current);
        catalog.retireTag("people", 3); // a column dropped earlier

        Schema altered = converter.addColumns("people", current, List.of(SqlColumn.of("email", SqlType.TEXT, true, false)));
        assertEquals(List.of(0L, 1L, 2L, 4L), altered.allColumns().tags());
        assertEquals(Set.of(0L, 1L, 2L, 3L), catalog.tagHistory("people"));
    }

    @Test
    void addedColumnKeepsItsAnnotatedTag() {
        Schema current = Schema.of(TestSchemas.people().columnNamed("id").orElseThrow());
        List<SqlColumn> added = List.of(
            SqlColumn.of("x", SqlType.INT, true, false).withExtra("tag:12"),
            SqlColumn.of("y", SqlType.TEXT, true, false)
        );
        Schema altered = converter.addColumns("t", current, added);
        assertEquals(List.of(0L, 12L, 13L), altered.allColumns().tags());
    }

    @Test
    void addedColumnWithMalformedAnnotationFailsCleanly() {
        Schema current = Schema.of(TestSchemas.people().columnNamed("id").orElseThrow());
        List<SqlColumn> added = List.of(SqlColumn.of("x", SqlType.INT, true, false).withExtra("tag:five"));
        assertThrows(TagAnnotationException.class, () -> converter.addColumns("t", current, added));
    }

    @Test
    void resultSchemaUsesAnnotationOrPosition() {
        List<SqlColumn> cols = List.of(
            SqlColumn.of("a", SqlType.INT, false, true),
            SqlColumn.of("b", SqlType.TEXT, true, false).withExtra("tag:7")
        );
        Schema s = SqlSchemaConverter.toResultSchema(cols);
        assertTrue(s.isUnkeyed());
        assertEquals(List.of(0L, 7L), s.allColumns().tags());

        List<SqlColumn> clash = List.of(
            SqlColumn.of("a", SqlType.INT, true, false),
            SqlColumn.of("b", SqlType.INT, true, false).withExtra("tag:0")
        );
        assertThrows(DuplicateTagException.class, () -> SqlSchemaConverter.toResultSchema(clash));
    }
}
