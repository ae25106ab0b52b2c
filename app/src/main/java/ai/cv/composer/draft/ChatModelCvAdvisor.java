package ai.cv.composer.draft;

import dev.langchain4j.model.chat.ChatModel;
import java.util.Objects;

/**
 * CV advisor backed by a LangChain4j {@link ChatModel}, acting as an HR reviewer.
 */
public class ChatModelCvAdvisor implements CvAdvisor {

    private static final String REVIEWER_INSTRUCTIONS = """
You are an experienced HR specialist and CV reviewer.

Your job:
- Analyze the candidate's CV text.
- Give a score from 0 to 10.
- Provide clear, practical, and kind feedback.
- Output structure:
1) Overall score
2) Strengths
3) Weaknesses
4) Suggestions and example improvements.
""";

    private static final String MISSING_SECTIONS_INSTRUCTIONS = """
You are an HR expert helping a candidate improve their CV.

Given the CV text, identify which standard CV sections are missing or weak.
Standard sections: %s.

Return a friendly text addressed to the user that:
- briefly summarises which sections are missing or incomplete
- asks the user to provide the missing information in plain text
- explicitly lists what you want them to write as bullet points.
Do not invent any data.
""".formatted(String.join(", ", StandardSection.displayNames()));

    private final ChatModelInvoker invoker;

    public ChatModelCvAdvisor(ChatModel model, String providerName, String modelName) {
        this.invoker = new ChatModelInvoker(model, providerName, modelName);
    }

    @Override
    public String review(DraftRequest request) {
        Objects.requireNonNull(request, "request");
        return invoker.ask("CV review", buildReviewPrompt(request)).strip();
    }

    @Override
    public String missingInformation(DraftRequest request) {
        Objects.requireNonNull(request, "request");
        return invoker.ask("missing information check", buildMissingInformationPrompt(request)).strip();
    }

    String buildReviewPrompt(DraftRequest request) {
        return REVIEWER_INSTRUCTIONS + """

Here is the CV text:

%s

Analyze this CV according to the instructions above.
""".formatted(request.sourceText());
    }

    String buildMissingInformationPrompt(DraftRequest request) {
        return MISSING_SECTIONS_INSTRUCTIONS + """

The user prefers to communicate in: %s.

Here is the CV text:

%s

Identify missing or weak sections and ask the user to provide the missing information. \
Write the whole answer in the preferred language.
""".formatted(request.language(), request.sourceText());
    }
}
