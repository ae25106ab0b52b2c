package ai.cv.composer.compose;

import ai.cv.composer.layout.Block;
import ai.cv.composer.layout.BlockBuilder;
import ai.cv.composer.layout.DefaultBlockBuilder;
import ai.cv.composer.render.DocumentRenderer;
import ai.cv.composer.render.PageGeometry;
import ai.cv.composer.render.PaginatedDocument;
import ai.cv.composer.render.PaginatingRenderer;
import ai.cv.composer.style.StyleResolver;
import ai.cv.composer.style.StyledBlock;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs markup through the block builder, the style resolver and the renderer. Holds no per-document state.
 */
public class DocumentComposer {

    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentComposer.class);

    private final BlockBuilder blockBuilder;
    private final StyleResolver styleResolver;
    private final DocumentRenderer renderer;

    public DocumentComposer() {
        this(new DefaultBlockBuilder(), new StyleResolver(), new PaginatingRenderer());
    }

    public DocumentComposer(BlockBuilder blockBuilder, StyleResolver styleResolver, DocumentRenderer renderer) {
        this.blockBuilder = Objects.requireNonNull(blockBuilder, "blockBuilder");
        this.styleResolver = Objects.requireNonNull(styleResolver, "styleResolver");
        this.renderer = Objects.requireNonNull(renderer, "renderer");
    }

    public Composition compose(String markup, PageGeometry geometry) {
        Objects.requireNonNull(geometry, "geometry");
        List<Block> blocks = blockBuilder.build(markup);
        List<StyledBlock> styledBlocks = styleResolver.resolveAll(blocks);
        PaginatedDocument document = renderer.render(styledBlocks, geometry);
        LOGGER.info("Composed {} blocks onto {} page(s)", styledBlocks.size(), document.pageCount());
        return new Composition(styledBlocks, document);
    }
}
