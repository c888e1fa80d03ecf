package db.tagged.catalog;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import db.tagged.error.SchemaValidationException;
import db.tagged.error.UnmappableColumnException;

public class SchemaTest {
    @Test
    void keyAndNonKeyViewsFollowDeclaredOrder() {
        Schema s = Schema.of(
            Column.of("region", 7, TypeDescriptor.STRING, true, ColumnConstraint.NOT_NULL),
            Column.of("note", 3, TypeDescriptor.STRING, false),
            Column.of("id", 2, TypeDescriptor.INT, true, ColumnConstraint.NOT_NULL)
        );
        assertEquals(List.of("region", "id"), s.primaryKeyColumns().stream().map(Column::name).toList());
        assertEquals(List.of("note"), s.nonKeyColumns().stream().map(Column::name).toList());
        assertSame(s.primaryKeyColumns(), s.primaryKeyColumns());
        assertEquals(3, s.allColumns().size());
    }

    @Test
    void nullablePrimaryKeyIsRejected() {
        assertThrows(SchemaValidationException.class,
            () -> Schema.of(Column.of("id", 0, TypeDescriptor.INT, true)));
    }

    @Test
    void twoAutoIncrementColumnsAreRejected() {
        Column a = new Column(0, "a", TypeDescriptor.INT, true, null, true, "", java.util.Set.of(ColumnConstraint.NOT_NULL));
        Column b = new Column(1, "b", TypeDescriptor.INT, false, null, true, "", null);
        assertThrows(SchemaValidationException.class, () -> Schema.of(a, b));
    }

    @Test
    void unkeyedSchemaSkipsKeyValidation() {
        Schema s = Schema.unkeyed(ColumnCollection.of(Column.of("id", 0, TypeDescriptor.INT, true)));
        assertTrue(s.isUnkeyed());
        assertTrue(s.primaryKeyColumns().isEmpty());
        assertEquals(1, s.nonKeyColumns().size());
    }

    @Test
    void projectionKeepsTagsAndFailsOnUnknownName() {
        Schema people = TestSchemas.people();
        Schema p = people.project(List.of("age", "id"));
        assertTrue(p.isUnkeyed());
        assertEquals(List.of(TestSchemas.AGE_TAG, TestSchemas.ID_TAG), p.allColumns().tags());

        UnmappableColumnException e = assertThrows(UnmappableColumnException.class, () -> people.project(List.of("nope")));
        assertTrue(e.getMessage().contains("nope"));
    }

    @Test
    void insertValidationNeedsKeyAndIntegralAutoIncrement() {
        Schema keyless = Schema.of(Column.of("v", 0, TypeDescriptor.INT, false));
        assertThrows(SchemaValidationException.class, keyless::validateForInsert);

        Column pk = Column.of("id", 0, TypeDescriptor.INT, true, ColumnConstraint.NOT_NULL);
        Column autoText = new Column(1, "t", TypeDescriptor.STRING, false, null, true, "", null);
        assertThrows(SchemaValidationException.class, () -> Schema.of(pk, autoText).validateForInsert());

        TestSchemas.people().validateForInsert();
    }

    @Test
    void alteredColumnKeepsItsTag() {
        Column c = Column.of("name", 1, TypeDescriptor.STRING, false);
        Column renamed = c.withName("full_name").withNullable(false);
        assertEquals(1L, renamed.tag());
        assertFalse(renamed.nullable());
        assertTrue(c.nullable());
    }

    @Test
    void schemasCompareByValue() {
        assertEquals(TestSchemas.people(), TestSchemas.people());
        assertNotEquals(TestSchemas.people(), TestSchemas.people().project(List.of()));
    }
}
