package ai.cv.composer.draft;

/**
 * Runtime exception used to propagate draft generation failures.
 */
public class DraftGenerationException extends RuntimeException {

    public DraftGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
