package ai.cv.composer.style;

import ai.cv.composer.layout.Block;
import java.util.Objects;

/**
 * A block paired with the style resolved for it.
 */
public record StyledBlock(Block block, StyleDescriptor style) {

    public StyledBlock {
        Objects.requireNonNull(block, "block");
        Objects.requireNonNull(style, "style");
    }
}
