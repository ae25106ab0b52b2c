package ai.cv.composer.draft;

import dev.langchain4j.exception.ModelNotFoundException;
import dev.langchain4j.model.chat.ChatModel;
import java.util.Objects;

/**
 * Sends one prompt to a chat model and turns provider failures into {@link DraftGenerationException}s.
 */
final class ChatModelInvoker {

    private final ChatModel model;
    private final String providerName;
    private final String modelName;

    ChatModelInvoker(ChatModel model, String providerName, String modelName) {
        this.model = Objects.requireNonNull(model, "model");
        this.providerName = requireNonBlank(providerName, "providerName");
        this.modelName = requireNonBlank(modelName, "modelName");
    }

    String ask(String operation, String prompt) {
        try {
            String response = model.chat(prompt);
            return response == null ? "" : response;
        } catch (RuntimeException ex) {
            if (causedByMissingModel(ex)) {
                throw new DraftGenerationException("%s model '%s' is not available.".formatted(providerName, modelName), ex);
            }
            throw new DraftGenerationException("LangChain " + operation + " failed", ex);
        }
    }

    private static boolean causedByMissingModel(Throwable failure) {
        for (Throwable cause = failure; cause != null; cause = cause.getCause()) {
            if (cause instanceof ModelNotFoundException) {
                return true;
            }
        }
        return false;
    }

    private static String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value;
    }
}
