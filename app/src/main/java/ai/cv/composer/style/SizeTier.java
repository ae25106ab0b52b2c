package ai.cv.composer.style;

/**
 * Font size tiers in points, each with the line height used for wrapping.
 */
public enum SizeTier {
    TITLE(20, 24),
    HEADING(13, 16),
    BODY(10, 13);

    private final double fontSize;
    private final double leading;

    SizeTier(double fontSize, double leading) {
        this.fontSize = fontSize;
        this.leading = leading;
    }

    public double fontSize() {
        return fontSize;
    }

    public double leading() {
        return leading;
    }
}
