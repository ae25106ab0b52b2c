package ai.cv.composer.draft;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Sections a complete CV is expected to contain, with the words that reveal them in free text.
 */
enum StandardSection {
    PERSONAL_INFORMATION("Personal information", "personal information", "contact", "e-mail", "email", "phone"),
    PROFESSIONAL_SUMMARY("Professional summary", "summary", "profile", "about me"),
    WORK_EXPERIENCE("Work experience", "experience", "employment", "work history"),
    EDUCATION("Education", "education", "university", "degree", "school"),
    SKILLS("Skills", "skills"),
    LANGUAGES("Languages", "language"),
    CERTIFICATIONS("Certifications", "certification", "certificate"),
    PROJECTS("Projects", "project"),
    VOLUNTEERING("Volunteering", "volunteer"),
    OTHER("Other");

    private final String displayName;
    private final List<String> keywords;

    StandardSection(String displayName, String... keywords) {
        this.displayName = displayName;
        this.keywords = List.of(keywords);
    }

    String displayName() {
        return displayName;
    }

    /**
     * Keyword match on the lowercased text. {@link #OTHER} has no keywords and is never detected.
     */
    boolean isMentionedIn(String text) {
        String lowered = text.toLowerCase(Locale.ROOT);
        return keywords.stream().anyMatch(lowered::contains);
    }

    static List<StandardSection> detectable() {
        return Arrays.stream(values()).filter(section -> !section.keywords.isEmpty()).toList();
    }

    static List<String> displayNames() {
        return Arrays.stream(values()).map(StandardSection::displayName).toList();
    }
}
