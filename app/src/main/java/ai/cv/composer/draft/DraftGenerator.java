package ai.cv.composer.draft;

/**
 * Produces the CV markup that the block builder consumes.
 */
public interface DraftGenerator {

    String generate(DraftRequest request);
}
