package ai.cv.composer.render;

import ai.cv.composer.style.StyledBlock;
import java.util.List;

/**
 * Lays styled blocks out on pages. Implementations keep block order, never drop a block, and may break tables
 * between rows.
 */
public interface DocumentRenderer {

    PaginatedDocument render(List<StyledBlock> blocks, PageGeometry geometry);
}
