package ai.cv.composer.compose;

import ai.cv.composer.render.PaginatedDocument;
import ai.cv.composer.style.StyledBlock;
import java.util.List;
import java.util.Objects;

/**
 * Everything produced for one document: the styled blocks in source order and their page layout.
 */
public record Composition(List<StyledBlock> styledBlocks, PaginatedDocument document) {

    public Composition {
        styledBlocks = List.copyOf(Objects.requireNonNull(styledBlocks, "styledBlocks"));
        Objects.requireNonNull(document, "document");
    }

    public int blockCount() {
        return styledBlocks.size();
    }
}
