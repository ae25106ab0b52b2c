package ai.cv.composer.render;

/**
 * Page size and margins in points.
 */
public record PageGeometry(double width,
                           double height,
                           double marginTop,
                           double marginRight,
                           double marginBottom,
                           double marginLeft) {

    private static final double DEFAULT_MARGIN = 40;

    public PageGeometry {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Page dimensions must be positive");
        }
        if (marginTop < 0 || marginRight < 0 || marginBottom < 0 || marginLeft < 0) {
            throw new IllegalArgumentException("Page margins must not be negative");
        }
        if (marginLeft + marginRight >= width || marginTop + marginBottom >= height) {
            throw new IllegalArgumentException("Page margins leave no content area");
        }
    }

    public static PageGeometry a4() {
        return withUniformMargin(595.28, 841.89, DEFAULT_MARGIN);
    }

    public static PageGeometry letter() {
        return withUniformMargin(612, 792, DEFAULT_MARGIN);
    }

    public static PageGeometry withUniformMargin(double width, double height, double margin) {
        return new PageGeometry(width, height, margin, margin, margin, margin);
    }

    public double contentWidth() {
        return width - marginLeft - marginRight;
    }

    public double contentHeight() {
        return height - marginTop - marginBottom;
    }
}
