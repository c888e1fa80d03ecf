package db.tagged.catalog;

import java.util.List;
import java.util.Map;

import db.tagged.row.TaggedRow;

/**
 * Test fixtures. Every call builds fresh values so tests never share state.
 */
public final class TestSchemas {
    public static final long ID_TAG = 0;
    public static final long FIRST_TAG = 1;
    public static final long LAST_TAG = 2;
    public static final long IS_MARRIED_TAG = 3;
    public static final long AGE_TAG = 4;
    public static final long RATING_TAG = 6;

    private TestSchemas() {}

    /** people(id pk, first, last, is_married, age, rating) */
    public static Schema people() {
        return Schema.of(
            Column.of("id", ID_TAG, TypeDescriptor.INT, true, ColumnConstraint.NOT_NULL),
            Column.of("first", FIRST_TAG, TypeDescriptor.STRING, false, ColumnConstraint.NOT_NULL),
            Column.of("last", LAST_TAG, TypeDescriptor.STRING, false, ColumnConstraint.NOT_NULL),
            Column.of("is_married", IS_MARRIED_TAG, TypeDescriptor.BOOL, false),
            Column.of("age", AGE_TAG, TypeDescriptor.INT, false),
            Column.of("rating", RATING_TAG, TypeDescriptor.FLOAT, false)
        );
    }

    public static TaggedRow person(long id, String first, String last, boolean married, long age, double rating) {
        return TaggedRow.of(people(), Map.of(
            ID_TAG, StoredValue.ofInt(id),
            FIRST_TAG, StoredValue.ofString(first),
            LAST_TAG, StoredValue.ofString(last),
            IS_MARRIED_TAG, StoredValue.ofBool(married),
            AGE_TAG, StoredValue.ofInt(age),
            RATING_TAG, StoredValue.ofFloat(rating)
        ));
    }

    public static List<TaggedRow> simpsons() {
        return List.of(
            person(0, "Homer", "Simpson", true, 40, 8.5),
            person(1, "Marge", "Simpson", true, 38, 8),
            person(2, "Bart", "Simpson", false, 10, 9),
            person(3, "Lisa", "Simpson", false, 8, 10)
        );
    }

    /** (id INT tag 0 pk not null), (name STRING tag 1, nullable or not) */
    public static Schema idName(boolean nameNullable) {
        Column name = Column.of("name", 1, TypeDescriptor.STRING, false);
        return Schema.of(
            Column.of("id", 0, TypeDescriptor.INT, true, ColumnConstraint.NOT_NULL),
            nameNullable ? name : name.withNullable(false)
        );
    }

    /** (id tag 0), (age tag 4) */
    public static Schema beforeRating() {
        return Schema.of(
            Column.of("id", 0, TypeDescriptor.INT, true, ColumnConstraint.NOT_NULL),
            Column.of("age", 4, TypeDescriptor.INT, false)
        );
    }

    /** (id tag 0), (age tag 4), (rating tag 6 nullable) */
    public static Schema afterRating() {
        return Schema.of(
            Column.of("id", 0, TypeDescriptor.INT, true, ColumnConstraint.NOT_NULL),
            Column.of("age", 4, TypeDescriptor.INT, false),
            Column.of("rating", 6, TypeDescriptor.FLOAT, false)
        );
    }
}
