package ai.cv.composer.markup;

import java.util.List;
import java.util.Objects;

/**
 * Result of classifying one input line. Only {@link LineKind#TABLE_ROW} tokens carry cells;
 * only text kinds carry text.
 */
public record LineToken(LineKind kind, String text, List<String> cells) {

    private static final LineToken BLANK = new LineToken(LineKind.BLANK, "", List.of());

    public LineToken {
        Objects.requireNonNull(kind, "kind");
        text = text == null ? "" : text;
        cells = cells == null ? List.of() : List.copyOf(cells);
        if (kind == LineKind.TABLE_ROW && cells.isEmpty()) {
            throw new IllegalArgumentException("Table row token requires at least one cell");
        }
    }

    public static LineToken title(String text) {
        return new LineToken(LineKind.TITLE, text, List.of());
    }

    public static LineToken sectionHeading(String text) {
        return new LineToken(LineKind.SECTION_HEADING, text, List.of());
    }

    public static LineToken bulletItem(String text) {
        return new LineToken(LineKind.BULLET_ITEM, text, List.of());
    }

    public static LineToken tableRow(List<String> cells) {
        return new LineToken(LineKind.TABLE_ROW, "", cells);
    }

    public static LineToken blank() {
        return BLANK;
    }

    public static LineToken paragraph(String text) {
        return new LineToken(LineKind.PARAGRAPH, text, List.of());
    }

    public boolean isTableRow() {
        return kind == LineKind.TABLE_ROW;
    }
}
