package ai.cv.composer.draft;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Offline advisor that judges a CV by which standard sections its text mentions.
 */
public class MockCvAdvisor implements CvAdvisor {

    @Override
    public String review(DraftRequest request) {
        List<StandardSection> present = present(request);
        List<StandardSection> missing = missing(request);
        int score = Math.round(present.size() * 10f / StandardSection.detectable().size());

        List<String> lines = new ArrayList<>();
        lines.add("[MOCK] CV review");
        lines.add("1) Overall score: " + score + "/10");
        lines.add("2) Strengths");
        if (present.isEmpty()) {
            lines.add("- None of the standard sections were recognised");
        }
        present.forEach(section -> lines.add("- Covers " + lowercaseName(section)));
        lines.add("3) Weaknesses");
        if (missing.isEmpty()) {
            lines.add("- No standard section is missing");
        }
        missing.forEach(section -> lines.add("- No " + lowercaseName(section) + " section"));
        lines.add("4) Suggestions");
        missing.forEach(section -> lines.add("- Add " + lowercaseName(section)));
        if (missing.isEmpty()) {
            lines.add("- Quantify achievements in the work experience section");
        }
        return String.join("\n", lines);
    }

    @Override
    public String missingInformation(DraftRequest request) {
        List<StandardSection> missing = missing(request);
        List<String> lines = new ArrayList<>();
        lines.add("[MOCK] Missing information (" + request.language() + ")");
        if (missing.isEmpty()) {
            lines.add("Your CV already covers every standard section.");
            return String.join("\n", lines);
        }
        lines.add("Please describe the following in plain text:");
        missing.forEach(section -> lines.add("- " + section.displayName()));
        return String.join("\n", lines);
    }

    private static String lowercaseName(StandardSection section) {
        return section.displayName().toLowerCase(Locale.ROOT);
    }

    private static List<StandardSection> present(DraftRequest request) {
        return StandardSection.detectable().stream()
                .filter(section -> section.isMentionedIn(request.sourceText()))
                .toList();
    }

    private static List<StandardSection> missing(DraftRequest request) {
        return StandardSection.detectable().stream()
                .filter(section -> !section.isMentionedIn(request.sourceText()))
                .toList();
    }
}
