package ai.cv.composer.render;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Output of a {@link DocumentRenderer}: the pages in order, always at least one.
 */
public record PaginatedDocument(PageGeometry geometry, List<Page> pages) {

    public PaginatedDocument {
        Objects.requireNonNull(geometry, "geometry");
        pages = List.copyOf(Objects.requireNonNull(pages, "pages"));
        if (pages.isEmpty()) {
            throw new IllegalArgumentException("Document requires at least one page");
        }
    }

    public int pageCount() {
        return pages.size();
    }

    public List<PlacedBlock> placements() {
        return pages.stream()
                .flatMap(page -> page.placements().stream())
                .collect(Collectors.toUnmodifiableList());
    }
}
