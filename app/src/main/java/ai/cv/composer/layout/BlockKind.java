package ai.cv.composer.layout;

/**
 * Kinds of document blocks handed to the style resolver and renderer.
 */
public enum BlockKind {
    TITLE,
    HEADING,
    BULLET,
    PARAGRAPH,
    SPACER,
    TABLE;

    public boolean carriesText() {
        return this != SPACER && this != TABLE;
    }
}
