package ai.cv.composer.layout;

import ai.cv.composer.markup.DefaultLineClassifier;
import ai.cv.composer.markup.LineClassifier;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single forward pass over the input lines. Each call owns a fresh {@link BuildState}, so one instance can serve
 * concurrent callers.
 */
public class DefaultBlockBuilder implements BlockBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(DefaultBlockBuilder.class);

    private final LineClassifier classifier;

    public DefaultBlockBuilder() {
        this(new DefaultLineClassifier());
    }

    public DefaultBlockBuilder(LineClassifier classifier) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
    }

    @Override
    public List<Block> build(String rawText) {
        if (rawText == null || rawText.isEmpty()) {
            return List.of();
        }
        List<String> lines = rawText.lines().collect(Collectors.toList());
        BuildState state = new BuildState();
        for (String line : lines) {
            state.accept(classifier.classify(line));
        }
        List<Block> blocks = state.finish();
        LOGGER.debug("Built {} blocks from {} lines", blocks.size(), lines.size());
        return blocks;
    }
}
