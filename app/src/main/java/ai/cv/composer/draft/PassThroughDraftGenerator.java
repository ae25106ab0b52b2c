package ai.cv.composer.draft;

/**
 * Treats the source text as finished markup without invoking remote APIs.
 */
public class PassThroughDraftGenerator implements DraftGenerator {

    @Override
    public String generate(DraftRequest request) {
        return request.sourceText();
    }
}
