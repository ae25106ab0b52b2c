package ai.cv.composer.style;

import ai.cv.composer.layout.Block;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Looks up each block's presentation in a {@link StyleSheet}.
 */
public class StyleResolver {

    private final StyleSheet styleSheet;

    public StyleResolver() {
        this(StyleSheet.standard());
    }

    public StyleResolver(StyleSheet styleSheet) {
        this.styleSheet = Objects.requireNonNull(styleSheet, "styleSheet");
    }

    public StyleDescriptor resolve(Block block) {
        return styleSheet.styleFor(Objects.requireNonNull(block, "block").kind());
    }

    public List<StyledBlock> resolveAll(List<Block> blocks) {
        if (blocks == null || blocks.isEmpty()) {
            return List.of();
        }
        return blocks.stream()
                .map(block -> new StyledBlock(block, resolve(block)))
                .collect(Collectors.toUnmodifiableList());
    }

    public StyleSheet styleSheet() {
        return styleSheet;
    }
}
