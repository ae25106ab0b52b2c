package ai.cv.composer.render;

import ai.cv.composer.layout.Block;
import ai.cv.composer.layout.BlockKind;
import ai.cv.composer.style.StyleDescriptor;
import ai.cv.composer.style.StyledBlock;
import ai.cv.composer.style.TableStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Flows blocks top to bottom and opens a new page whenever the next block or table row would overflow the content
 * area. Spacing before a block is dropped at the top of a page. A single block taller than a page is placed alone and
 * allowed to overflow rather than being lost.
 */
public class PaginatingRenderer implements DocumentRenderer {

    private static final Logger LOGGER = LoggerFactory.getLogger(PaginatingRenderer.class);

    @Override
    public PaginatedDocument render(List<StyledBlock> blocks, PageGeometry geometry) {
        Objects.requireNonNull(geometry, "geometry");
        PageCursor cursor = new PageCursor(geometry);
        if (blocks != null) {
            for (StyledBlock styledBlock : blocks) {
                if (styledBlock.block().kind() == BlockKind.TABLE) {
                    placeTable(styledBlock, cursor);
                } else {
                    placeText(styledBlock, cursor);
                }
            }
        }
        PaginatedDocument document = cursor.finish();
        LOGGER.debug("Laid out {} blocks on {} pages", blocks == null ? 0 : blocks.size(), document.pageCount());
        return document;
    }

    private void placeText(StyledBlock styledBlock, PageCursor cursor) {
        StyleDescriptor style = styledBlock.style();
        double height = textHeight(styledBlock, cursor.geometry());
        double top = cursor.topFor(style.spacingBefore());
        if (!cursor.atPageTop() && top + height > cursor.contentHeight()) {
            cursor.newPage();
            top = cursor.topFor(style.spacingBefore());
        }
        cursor.place(PlacedBlock.of(styledBlock, top, height), top + height + style.spacingAfter());
    }

    private void placeTable(StyledBlock styledBlock, PageCursor cursor) {
        Block table = styledBlock.block();
        StyleDescriptor style = styledBlock.style();
        TableStyle tableStyle = style.tableStyle().orElse(null);
        double availableWidth = cursor.geometry().contentWidth() - style.leftIndent();
        int columns = Math.max(1, table.columnCount());

        double top = cursor.topFor(style.spacingBefore());
        double fragmentHeight = 0;
        int firstRow = 0;
        for (int row = 0; row < table.rowCount(); row++) {
            double rowHeight = rowHeight(table.rows().get(row), columns, availableWidth, style, tableStyle);
            boolean overflows = top + fragmentHeight + rowHeight > cursor.contentHeight();
            if (overflows && (fragmentHeight > 0 || !cursor.atPageTop())) {
                if (fragmentHeight > 0) {
                    cursor.place(new PlacedBlock(styledBlock, top, fragmentHeight, firstRow, row - firstRow),
                            top + fragmentHeight);
                }
                cursor.newPage();
                top = 0;
                fragmentHeight = 0;
                firstRow = row;
            }
            fragmentHeight += rowHeight;
        }
        cursor.place(new PlacedBlock(styledBlock, top, fragmentHeight, firstRow, table.rowCount() - firstRow),
                top + fragmentHeight + style.spacingAfter());
    }

    private double textHeight(StyledBlock styledBlock, PageGeometry geometry) {
        Block block = styledBlock.block();
        if (block.kind() == BlockKind.SPACER) {
            return 0;
        }
        StyleDescriptor style = styledBlock.style();
        double availableWidth = geometry.contentWidth() - style.leftIndent();
        int maxChars = TextMetrics.charactersPerLine(availableWidth, style.size().fontSize());
        return TextMetrics.lineCount(block.text(), maxChars) * style.size().leading();
    }

    private double rowHeight(List<String> row, int columns, double availableWidth, StyleDescriptor style,
                             TableStyle tableStyle) {
        double horizontalPadding = tableStyle == null ? 0 : tableStyle.horizontalPadding();
        double verticalPadding = tableStyle == null ? 0 : tableStyle.verticalPadding();
        double cellWidth = Math.max(1, availableWidth / columns - 2 * horizontalPadding);
        int maxChars = TextMetrics.charactersPerLine(cellWidth, style.size().fontSize());
        int lines = 1;
        for (String cell : row) {
            lines = Math.max(lines, TextMetrics.lineCount(cell, maxChars));
        }
        return lines * style.size().leading() + 2 * verticalPadding;
    }

    /**
     * Mutable layout position for a single render call.
     */
    private static final class PageCursor {

        private final PageGeometry geometry;
        private final List<Page> pages = new ArrayList<>();
        private List<PlacedBlock> current = new ArrayList<>();
        private double offset;

        PageCursor(PageGeometry geometry) {
            this.geometry = geometry;
        }

        PageGeometry geometry() {
            return geometry;
        }

        double contentHeight() {
            return geometry.contentHeight();
        }

        boolean atPageTop() {
            return current.isEmpty() && offset == 0;
        }

        double topFor(double spacingBefore) {
            return atPageTop() ? 0 : offset + spacingBefore;
        }

        void place(PlacedBlock placement, double nextOffset) {
            current.add(placement);
            offset = nextOffset;
        }

        void newPage() {
            pages.add(new Page(pages.size() + 1, current));
            current = new ArrayList<>();
            offset = 0;
        }

        PaginatedDocument finish() {
            if (!current.isEmpty() || pages.isEmpty()) {
                pages.add(new Page(pages.size() + 1, current));
            }
            return new PaginatedDocument(geometry, pages);
        }
    }
}
