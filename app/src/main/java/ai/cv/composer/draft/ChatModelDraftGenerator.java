package ai.cv.composer.draft;

import dev.langchain4j.model.chat.ChatModel;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Draft generator backed by a LangChain4j {@link ChatModel}. The model is asked for the final CV in the markup dialect
 * understood by the block builder.
 */
public class ChatModelDraftGenerator implements DraftGenerator {

    private static final String FENCE = "```";

    private final ChatModelInvoker invoker;

    public ChatModelDraftGenerator(ChatModel model, String providerName, String modelName) {
        this.invoker = new ChatModelInvoker(model, providerName, modelName);
    }

    @Override
    public String generate(DraftRequest request) {
        Objects.requireNonNull(request, "request");
        return stripWrappingFence(invoker.ask("draft generation", buildPrompt(request)));
    }

    String buildPrompt(DraftRequest request) {
        return """
You are a professional CV writer.
Rules:
- Use only the information from the original CV text and the additional information below. Do not invent data.
- If a typical section has no data, omit that section completely.
- The first line must be "# Full Name" with the candidate's name.
- Start every section with "## " followed by an uppercase section name, for example "## WORK EXPERIENCE".
- Write list items as lines starting with "- ". Do not nest lists.
- Write language skills as a table with one row per line, cells separated by "|", and the line starting and ending with "|".
- Do not use links, images, emphasis markers, or headings deeper than "##".
- Output only the CV content as plain text. Do not wrap it in code fences and do not add commentary.

Target CV format: %s
Target language: %s

<cv>
%s
</cv>

<additional-information>
%s
</additional-information>
""".formatted(request.cvFormat(), request.language(), request.sourceText(),
                request.extraInfo().orElse("(no additional information provided)"));
    }

    private String stripWrappingFence(String response) {
        List<String> lines = new ArrayList<>(Arrays.asList(response.strip().split("\\R", -1)));
        if (lines.size() >= 2 && lines.get(0).strip().startsWith(FENCE)
                && lines.get(lines.size() - 1).strip().equals(FENCE)) {
            lines.remove(lines.size() - 1);
            lines.remove(0);
        }
        return String.join("\n", lines);
    }
}
