package ai.cv.composer.markup;

/**
 * Classification of a single line of CV markup.
 */
public enum LineKind {
    TITLE,
    SECTION_HEADING,
    BULLET_ITEM,
    TABLE_ROW,
    BLANK,
    PARAGRAPH
}
