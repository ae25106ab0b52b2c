package ai.cv.composer.render;

import java.util.List;

public record Page(int number, List<PlacedBlock> placements) {

    public Page {
        if (number < 1) {
            throw new IllegalArgumentException("Page numbers start at 1");
        }
        placements = placements == null ? List.of() : List.copyOf(placements);
    }
}
