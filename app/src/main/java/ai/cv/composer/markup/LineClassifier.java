package ai.cv.composer.markup;

/**
 * Maps a raw line of CV markup to its token. Implementations must be stateless.
 */
public interface LineClassifier {

    LineToken classify(String line);
}
