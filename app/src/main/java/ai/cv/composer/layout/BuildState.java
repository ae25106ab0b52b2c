package ai.cv.composer.layout;

import ai.cv.composer.markup.LineToken;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Per-document state of the block builder: the current phase, the pending table rows and the blocks emitted so far.
 */
public class BuildState {

    /**
     * Whether the builder is inside a run of table rows.
     */
    public enum Phase {
        OUTSIDE,
        IN_TABLE
    }

    private final TableAccumulator accumulator = new TableAccumulator();
    private final List<Block> blocks = new ArrayList<>();
    private Phase phase = Phase.OUTSIDE;
    private boolean finished;

    public void accept(LineToken token) {
        Objects.requireNonNull(token, "token");
        if (finished) {
            throw new IllegalStateException("Build state already finished");
        }
        if (token.isTableRow()) {
            accumulator.push(token.cells());
            phase = Phase.IN_TABLE;
            return;
        }
        if (phase == Phase.IN_TABLE) {
            closeTable();
        }
        blocks.add(toBlock(token));
    }

    public List<Block> finish() {
        if (!finished) {
            if (phase == Phase.IN_TABLE) {
                closeTable();
            }
            finished = true;
        }
        return List.copyOf(blocks);
    }

    public Phase phase() {
        return phase;
    }

    public int pendingRows() {
        return accumulator.size();
    }

    private void closeTable() {
        accumulator.flush().ifPresent(blocks::add);
        phase = Phase.OUTSIDE;
    }

    private static Block toBlock(LineToken token) {
        return switch (token.kind()) {
            case TITLE -> Block.title(token.text());
            case SECTION_HEADING -> Block.heading(token.text());
            case BULLET_ITEM -> Block.bullet(token.text());
            case PARAGRAPH -> Block.paragraph(token.text());
            case BLANK -> Block.spacer();
            case TABLE_ROW -> throw new IllegalStateException("Table rows are accumulated, not converted");
        };
    }
}
