package ai.cv.composer.draft;

/**
 * Gives feedback on a source CV instead of rewriting it.
 */
public interface CvAdvisor {

    /**
     * Scores the CV from 0 to 10 and lists strengths, weaknesses and suggestions.
     */
    String review(DraftRequest request);

    /**
     * Asks the candidate, in the request language, for the sections that are missing or weak. The answer is meant to
     * be written into the extra information file of a later draft.
     */
    String missingInformation(DraftRequest request);
}
