package io.simpledb.shell;

import java.io.PrintStream;
import java.util.List;

import io.simpledb.query.batch.RecordBatch;
import io.simpledb.query.types.StructType;
import io.simpledb.query.types.Value;

/**
 * Renders query results as a bordered text table, one header per field display name.
 * <pre>
 * +-------+------+
 * | t1.id | name |
 * +-------+------+
 * | 1     | a    |
 * +-------+------+
 * </pre>
 */
public final class TablePrinter {
    private TablePrinter() {}

    public static void print(StructType schema, List<RecordBatch> batches, PrintStream out) {
        out.print(format(schema, batches));
    }

    public static String format(StructType schema, List<RecordBatch> batches) {
        List<String> headers = schema.fieldNames();
        int colCount = headers.size();
        int[] widths = new int[colCount];
        for (int i = 0; i < colCount; i++) {
            widths[i] = headers.get(i).length();
        }
        int rowCount = 0;
        for (RecordBatch batch : batches) {
            rowCount += batch.numRows();
            for (int c = 0; c < colCount; c++) {
                for (Value v : batch.column(c).values()) {
                    widths[c] = Math.max(widths[c], v.toString().length());
                }
            }
        }

        StringBuilder sb = new StringBuilder();
        String divider = buildDivider(widths);
        sb.append(divider).append('\n');
        appendLine(sb, headers.toArray(new String[0]), widths);
        sb.append(divider).append('\n');
        String[] cells = new String[colCount];
        for (RecordBatch batch : batches) {
            for (int r = 0; r < batch.numRows(); r++) {
                for (int c = 0; c < colCount; c++) {
                    cells[c] = batch.column(c).get(r).toString();
                }
                appendLine(sb, cells, widths);
            }
        }
        if (rowCount > 0) {
            sb.append(divider).append('\n');
        }
        sb.append('(').append(rowCount).append(" row(s))\n");
        return sb.toString();
    }

    private static String buildDivider(int[] widths) {
        StringBuilder divider = new StringBuilder();
        divider.append('+');
        for (int w : widths) {
            for (int k = 0; k < w + 2; k++) divider.append('-');
            divider.append('+');
        }
        return divider.toString();
    }

    private static void appendLine(StringBuilder sb, String[] cells, int[] widths) {
        sb.append('|');
        for (int i = 0; i < cells.length; i++) {
            sb.append(' ').append(pad(cells[i], widths[i])).append(' ').append('|');
        }
        sb.append('\n');
    }

    private static String pad(String s, int width) {
        if (s.length() >= width) return s;
        StringBuilder sb = new StringBuilder(width);
        sb.append(s);
        for (int i = s.length(); i < width; i++) sb.append(' ');
        return sb.toString();
    }
}
