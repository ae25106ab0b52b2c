package ai.cv.composer.style;

import java.util.Objects;
import java.util.Optional;

/**
 * Grid and cell styling for table blocks. Colours are {@code #RRGGBB} strings.
 */
public record TableStyle(double gridLineWidth,
                         String gridColor,
                         Optional<String> headerBackground,
                         double horizontalPadding,
                         double verticalPadding,
                         boolean verticallyCentered) {

    public TableStyle {
        if (gridLineWidth < 0 || horizontalPadding < 0 || verticalPadding < 0) {
            throw new IllegalArgumentException("Table style dimensions must not be negative");
        }
        gridColor = Objects.requireNonNull(gridColor, "gridColor");
        headerBackground = headerBackground == null ? Optional.empty() : headerBackground;
    }

    public boolean hasGrid() {
        return gridLineWidth > 0;
    }

    /**
     * A single-row table has no header to shade.
     */
    public boolean shadesHeaderRow(int rowCount) {
        return headerBackground.isPresent() && rowCount > 1;
    }
}
