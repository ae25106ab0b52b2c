package ai.cv.composer.markup;

import java.util.ArrayList;
import java.util.List;

/**
 * Default classifier for the CV markup dialect. Rules are checked in order and the first match wins:
 * table row, blank, {@code "# "} title, {@code "## "} section heading, {@code "- "} bullet, paragraph.
 * Deeper headings such as {@code "### "} are plain paragraphs.
 */
public class DefaultLineClassifier implements LineClassifier {

    private static final char CELL_DELIMITER = '|';
    private static final String TITLE_MARKER = "# ";
    private static final String SECTION_MARKER = "## ";
    private static final String BULLET_MARKER = "- ";

    @Override
    public LineToken classify(String line) {
        if (line == null) {
            return LineToken.blank();
        }
        String stripped = line.strip();
        if (isTableRow(stripped)) {
            return LineToken.tableRow(splitCells(stripped));
        }
        if (stripped.isEmpty()) {
            return LineToken.blank();
        }
        if (stripped.startsWith(TITLE_MARKER)) {
            return LineToken.title(stripped.substring(TITLE_MARKER.length()).strip());
        }
        if (stripped.startsWith(SECTION_MARKER)) {
            return LineToken.sectionHeading(stripped.substring(SECTION_MARKER.length()).strip());
        }
        if (stripped.startsWith(BULLET_MARKER)) {
            return LineToken.bulletItem(stripped.substring(BULLET_MARKER.length()).strip());
        }
        return LineToken.paragraph(stripped);
    }

    private boolean isTableRow(String stripped) {
        if (stripped.length() < 3) {
            return false;
        }
        return stripped.charAt(0) == CELL_DELIMITER
                && stripped.charAt(stripped.length() - 1) == CELL_DELIMITER
                && stripped.indexOf(CELL_DELIMITER, 1) < stripped.length() - 1;
    }

    private List<String> splitCells(String stripped) {
        int from = 0;
        int to = stripped.length();
        while (from < to && stripped.charAt(from) == CELL_DELIMITER) {
            from++;
        }
        while (to > from && stripped.charAt(to - 1) == CELL_DELIMITER) {
            to--;
        }
        String inner = stripped.substring(from, to);
        List<String> cells = new ArrayList<>();
        int start = 0;
        int next;
        while ((next = inner.indexOf(CELL_DELIMITER, start)) >= 0) {
            cells.add(inner.substring(start, next).strip());
            start = next + 1;
        }
        cells.add(inner.substring(start).strip());
        return cells;
    }
}
