package ai.cv.composer.render;

import ai.cv.composer.layout.BlockKind;
import ai.cv.composer.style.StyledBlock;
import java.util.List;
import java.util.Objects;

/**
 * A styled block positioned on a page. {@code top} is measured from the top of the content area. Table blocks split
 * across pages produce one placement per page, each covering {@code rowCount} rows starting at {@code firstRow}.
 */
public record PlacedBlock(StyledBlock styledBlock, double top, double height, int firstRow, int rowCount) {

    public PlacedBlock {
        Objects.requireNonNull(styledBlock, "styledBlock");
        if (top < 0 || height < 0) {
            throw new IllegalArgumentException("Placement offsets must not be negative");
        }
        if (firstRow < 0 || rowCount < 0 || firstRow + rowCount > styledBlock.block().rowCount()) {
            throw new IllegalArgumentException("Row range outside of the table");
        }
    }

    public static PlacedBlock of(StyledBlock styledBlock, double top, double height) {
        return new PlacedBlock(styledBlock, top, height, 0, 0);
    }

    public BlockKind kind() {
        return styledBlock.block().kind();
    }

    public List<List<String>> rows() {
        return styledBlock.block().rows().subList(firstRow, firstRow + rowCount);
    }

    public boolean isTableContinuation() {
        return kind() == BlockKind.TABLE && firstRow > 0;
    }
}
