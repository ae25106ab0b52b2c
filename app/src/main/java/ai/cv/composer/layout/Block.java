package ai.cv.composer.layout;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Immutable unit of document content. Text kinds carry {@code text}; {@link BlockKind#TABLE} carries a non-empty
 * list of rows whose cell counts may differ; {@link BlockKind#SPACER} carries neither.
 */
public record Block(BlockKind kind, String text, List<List<String>> rows) {

    private static final Block SPACER = new Block(BlockKind.SPACER, "", List.of());

    public Block {
        Objects.requireNonNull(kind, "kind");
        text = text == null ? "" : text;
        rows = rows == null
                ? List.of()
                : rows.stream().map(List::copyOf).collect(Collectors.toUnmodifiableList());
        if (kind == BlockKind.TABLE && rows.isEmpty()) {
            throw new IllegalArgumentException("Table block requires at least one row");
        }
        if (kind != BlockKind.TABLE && !rows.isEmpty()) {
            throw new IllegalArgumentException(kind + " block cannot carry table rows");
        }
    }

    public static Block title(String text) {
        return new Block(BlockKind.TITLE, text, List.of());
    }

    public static Block heading(String text) {
        return new Block(BlockKind.HEADING, text, List.of());
    }

    public static Block bullet(String text) {
        return new Block(BlockKind.BULLET, text, List.of());
    }

    public static Block paragraph(String text) {
        return new Block(BlockKind.PARAGRAPH, text, List.of());
    }

    public static Block spacer() {
        return SPACER;
    }

    public static Block table(List<List<String>> rows) {
        return new Block(BlockKind.TABLE, "", rows);
    }

    public int rowCount() {
        return rows.size();
    }

    public int columnCount() {
        return rows.stream().mapToInt(List::size).max().orElse(0);
    }
}
