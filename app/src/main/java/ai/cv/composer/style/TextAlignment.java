package ai.cv.composer.style;

/**
 * Horizontal alignment of a block's text within the content area.
 */
public enum TextAlignment {
    LEFT,
    CENTER,
    RIGHT,
    JUSTIFY
}
