package ai.coursedoc.transcoder.render;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds {@code aligned} blocks out of already rendered equation rows.
 *
 * <p>Two row rules exist. Rows of an equation array found inside one expression always receive a marker,
 * at the leading or first equals sign, or at the start of the row. Sibling rows of a display block only get
 * a marker where an equals sign exists; rows without one are left untouched.
 */
public final class AlignmentBuilder {

    static final String MARKER = "&";
    static final String LINE_BREAK = " \\\\\n";
    private static final String BEGIN = "\\begin{aligned}\n";
    private static final String END = "\n\\end{aligned}";

    /**
     * Joins sibling display rows. A single row is returned as is, no rows yield an empty string.
     */
    public String combine(List<String> rows) {
        if (rows == null || rows.isEmpty()) {
            return "";
        }
        if (rows.size() == 1) {
            return rows.get(0);
        }
        List<String> aligned = new ArrayList<>(rows.size());
        aligned.add(markFirstEquals(rows.get(0)));
        for (String row : rows.subList(1, rows.size())) {
            aligned.add(alignFollowingRow(row));
        }
        return wrap(aligned);
    }

    /**
     * Marks and joins the rendered rows of an equation array. Empty rows are dropped.
     */
    public String alignArrayRows(List<String> rows) {
        List<String> aligned = new ArrayList<>(rows.size());
        for (String row : rows) {
            if (!row.isEmpty()) {
                aligned.add(alignArrayRow(row));
            }
        }
        return aligned.isEmpty() ? "" : wrap(aligned);
    }

    static String alignArrayRow(String row) {
        String trimmed = row.strip();
        if (trimmed.startsWith("=")) {
            return MARKER + trimmed;
        }
        if (row.contains("=")) {
            return markFirstEquals(row);
        }
        return MARKER + row;
    }

    static String alignFollowingRow(String row) {
        String trimmed = row.strip();
        if (trimmed.startsWith("=")) {
            return MARKER + trimmed;
        }
        return markFirstEquals(row);
    }

    static String markFirstEquals(String row) {
        int index = row.indexOf('=');
        if (index < 0) {
            return row;
        }
        return row.substring(0, index) + MARKER + row.substring(index);
    }

    private static String wrap(List<String> rows) {
        return BEGIN + String.join(LINE_BREAK, rows) + END;
    }
}
