package ai.cv.composer.draft;

import java.util.Locale;

/**
 * What the tool produces from the source CV: a laid out draft, a scored review, or questions about missing sections.
 */
public enum CvAction {
    DRAFT,
    REVIEW,
    MISSING_INFO;

    public static CvAction from(String raw) {
        if (raw == null || raw.isBlank()) {
            return DRAFT;
        }
        String normalized = raw.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        for (CvAction action : values()) {
            if (action.name().equals(normalized)) {
                return action;
            }
        }
        throw new IllegalArgumentException("Unsupported action: " + raw);
    }

    public boolean producesLayout() {
        return this == DRAFT;
    }
}
