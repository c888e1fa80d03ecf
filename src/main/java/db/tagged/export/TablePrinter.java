package db.tagged.export;

import java.io.PrintStream;
import java.util.List;

import db.tagged.sql.SqlColumn;
import db.tagged.sql.SqlRow;

/**
 * ASCII table rendering of ordinal rows, for diagnostics and test output.
 * Headers come from the column list; null slots print as NULL.
 */
public final class TablePrinter {
    private static final String NULL_TEXT = "NULL";

    private TablePrinter() {}

    public static void print(List<SqlColumn> columns, List<SqlRow> rows, PrintStream out) {
        out.print(render(columns, rows));
    }

    public static String render(List<SqlColumn> columns, List<SqlRow> rows) {
        int colCount = columns.size();
        String[] headers = new String[colCount];
        int[] widths = new int[colCount];
        for (int i = 0; i < colCount; i++) {
            headers[i] = columns.get(i).name();
            widths[i] = headers[i].length();
        }
        for (SqlRow r : rows) {
            if (r.size() != colCount) {
                throw new IllegalArgumentException("Arity mismatch: expected " + colCount + " values, got " + r.size());
            }
            for (int i = 0; i < colCount; i++) {
                widths[i] = Math.max(widths[i], cell(r.get(i)).length());
            }
        }

        String divider = divider(widths);
        StringBuilder sb = new StringBuilder();
        sb.append(divider).append('\n');
        appendLine(sb, headers, widths);
        sb.append(divider).append('\n');
        for (SqlRow r : rows) {
            String[] cells = new String[colCount];
            for (int i = 0; i < colCount; i++) cells[i] = cell(r.get(i));
            appendLine(sb, cells, widths);
        }
        if (!rows.isEmpty()) sb.append(divider).append('\n');
        sb.append('(').append(rows.size()).append(" row(s))").append('\n');
        return sb.toString();
    }

    private static String cell(Object v) {
        return v == null ? NULL_TEXT : String.valueOf(v);
    }

    private static String divider(int[] widths) {
        StringBuilder sb = new StringBuilder("+");
        for (int w : widths) sb.append("-".repeat(w + 2)).append('+');
        return sb.toString();
    }

    private static void appendLine(StringBuilder sb, String[] cells, int[] widths) {
        sb.append('|');
        for (int i = 0; i < cells.length; i++) {
            sb.append(' ').append(cells[i]).append(" ".repeat(widths[i] - cells[i].length())).append(" |");
        }
        sb.append('\n');
    }
}
