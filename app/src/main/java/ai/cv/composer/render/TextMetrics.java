package ai.cv.composer.render;

/**
 * Approximate text measurement based on an average glyph width, good enough for pagination without font files.
 */
final class TextMetrics {

    static final double AVERAGE_GLYPH_WIDTH = 0.5;

    private TextMetrics() {
    }

    static int charactersPerLine(double availableWidth, double fontSize) {
        return Math.max(1, (int) Math.floor(availableWidth / (fontSize * AVERAGE_GLYPH_WIDTH)));
    }

    /**
     * Greedy word wrap; words longer than a line are broken. Empty text still occupies one line.
     */
    static int lineCount(String text, int maxChars) {
        if (text == null || text.isBlank()) {
            return 1;
        }
        int lines = 1;
        int current = 0;
        for (String word : text.strip().split("\\s+")) {
            int length = word.length();
            if (current > 0 && current + 1 + length <= maxChars) {
                current += 1 + length;
                continue;
            }
            if (current > 0) {
                lines++;
            }
            while (length > maxChars) {
                lines++;
                length -= maxChars;
            }
            current = length;
        }
        return lines;
    }
}
