package ai.cv.composer.render;

/**
 * Named page presets selectable from the command line.
 */
public enum PageSize {
    A4,
    LETTER;

    public static PageSize from(String raw) {
        if (raw == null || raw.isBlank()) {
            return A4;
        }
        for (PageSize size : values()) {
            if (size.name().equalsIgnoreCase(raw.trim())) {
                return size;
            }
        }
        throw new IllegalArgumentException("Unsupported page size: " + raw);
    }

    public PageGeometry geometry() {
        return switch (this) {
            case A4 -> PageGeometry.a4();
            case LETTER -> PageGeometry.letter();
        };
    }
}
