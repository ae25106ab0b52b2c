package ai.cv.composer.layout;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Collects a run of consecutive table rows until they are flushed into a single table block.
 * Not thread-safe; each build owns its own instance.
 */
public class TableAccumulator {

    private final List<List<String>> pendingRows = new ArrayList<>();

    public void push(List<String> row) {
        pendingRows.add(List.copyOf(Objects.requireNonNull(row, "row")));
    }

    public Optional<Block> flush() {
        if (pendingRows.isEmpty()) {
            return Optional.empty();
        }
        Block table = Block.table(pendingRows);
        pendingRows.clear();
        return Optional.of(table);
    }

    public boolean isEmpty() {
        return pendingRows.isEmpty();
    }

    public int size() {
        return pendingRows.size();
    }
}
