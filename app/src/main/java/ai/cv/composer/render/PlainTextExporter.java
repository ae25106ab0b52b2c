package ai.cv.composer.render;

import ai.cv.composer.layout.Block;
import ai.cv.composer.style.StyleDescriptor;
import ai.cv.composer.style.TableStyle;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Writes a paginated document as plain text, one page after another. Table columns are padded to the widest cell of
 * the whole table so that fragments on different pages line up.
 */
public class PlainTextExporter {

    private static final double POINTS_PER_INDENT_CHAR = 6;

    public String export(PaginatedDocument document) {
        StringBuilder builder = new StringBuilder();
        for (Page page : document.pages()) {
            if (page.number() > 1) {
                builder.append(System.lineSeparator());
            }
            builder.append("--- Page ").append(page.number()).append(" of ").append(document.pageCount()).append(" ---")
                    .append(System.lineSeparator());
            for (PlacedBlock placement : page.placements()) {
                appendPlacement(builder, placement);
            }
        }
        return builder.toString();
    }

    private void appendPlacement(StringBuilder builder, PlacedBlock placement) {
        Block block = placement.styledBlock().block();
        StyleDescriptor style = placement.styledBlock().style();
        String indent = " ".repeat((int) Math.round(style.leftIndent() / POINTS_PER_INDENT_CHAR));
        String text = style.uppercase() ? block.text().toUpperCase(Locale.ROOT) : block.text();
        switch (block.kind()) {
            case TITLE -> appendUnderlined(builder, indent + text, '=');
            case HEADING -> appendUnderlined(builder, indent + text, '-');
            case BULLET -> appendLine(builder, indent + style.bulletGlyph().map(glyph -> glyph + " ").orElse("") + text);
            case PARAGRAPH -> appendLine(builder, indent + text);
            case SPACER -> appendLine(builder, "");
            case TABLE -> appendTable(builder, placement, indent, style);
        }
    }

    private void appendTable(StringBuilder builder, PlacedBlock placement, String indent, StyleDescriptor style) {
        Block table = placement.styledBlock().block();
        List<Integer> widths = columnWidths(table);
        boolean shadedHeader = style.tableStyle()
                .map(tableStyle -> tableStyle.shadesHeaderRow(table.rowCount()))
                .orElse(false);
        boolean grid = style.tableStyle().map(TableStyle::hasGrid).orElse(false);
        int rowIndex = placement.firstRow();
        for (List<String> row : placement.rows()) {
            appendLine(builder, indent + formatRow(row, widths, grid));
            if (rowIndex == 0 && shadedHeader) {
                appendLine(builder, indent + headerRule(widths, grid));
            }
            rowIndex++;
        }
    }

    private List<Integer> columnWidths(Block table) {
        List<Integer> widths = new ArrayList<>(Collections.nCopies(table.columnCount(), 0));
        for (List<String> row : table.rows()) {
            for (int column = 0; column < row.size(); column++) {
                widths.set(column, Math.max(widths.get(column), row.get(column).length()));
            }
        }
        return widths;
    }

    private String formatRow(List<String> row, List<Integer> widths, boolean grid) {
        List<String> cells = new ArrayList<>(widths.size());
        for (int column = 0; column < widths.size(); column++) {
            String cell = column < row.size() ? row.get(column) : "";
            cells.add(pad(cell, widths.get(column)));
        }
        return grid ? "| " + String.join(" | ", cells) + " |" : String.join("  ", cells);
    }

    private String headerRule(List<Integer> widths, boolean grid) {
        List<String> dashes = new ArrayList<>(widths.size());
        for (int width : widths) {
            dashes.add("-".repeat(Math.max(1, width)));
        }
        return grid ? "|-" + String.join("-|-", dashes) + "-|" : String.join("  ", dashes);
    }

    private static String pad(String value, int width) {
        return value.length() >= width ? value : value + " ".repeat(width - value.length());
    }

    private static void appendUnderlined(StringBuilder builder, String text, char underline) {
        appendLine(builder, text);
        appendLine(builder, String.valueOf(underline).repeat(Math.max(1, text.strip().length())));
    }

    private static void appendLine(StringBuilder builder, String line) {
        builder.append(line).append(System.lineSeparator());
    }
}
