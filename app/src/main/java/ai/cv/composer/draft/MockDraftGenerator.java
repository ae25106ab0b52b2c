package ai.cv.composer.draft;

import java.util.ArrayList;
import java.util.List;

/**
 * Deterministic draft for offline runs: lists the request settings and turns every source line into a bullet.
 */
public class MockDraftGenerator implements DraftGenerator {

    @Override
    public String generate(DraftRequest request) {
        List<String> lines = new ArrayList<>();
        lines.add("# [MOCK] CV draft");
        lines.add("## FORMAT");
        lines.add("- " + request.cvFormat());
        lines.add("## LANGUAGE");
        lines.add("- " + request.language());
        lines.add("");
        lines.add("## SOURCE");
        request.sourceText().lines()
                .map(String::strip)
                .filter(line -> !line.isEmpty())
                .forEach(line -> lines.add("- " + line));
        request.extraInfo().ifPresent(extra -> {
            lines.add("");
            lines.add("## ADDITIONAL INFORMATION");
            extra.lines()
                    .map(String::strip)
                    .filter(line -> !line.isEmpty())
                    .forEach(line -> lines.add("- " + line));
        });
        return String.join("\n", lines);
    }
}
