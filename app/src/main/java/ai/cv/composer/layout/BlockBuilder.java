package ai.cv.composer.layout;

import java.util.List;

/**
 * Converts CV markup text into an ordered list of blocks.
 */
public interface BlockBuilder {

    List<Block> build(String rawText);
}
