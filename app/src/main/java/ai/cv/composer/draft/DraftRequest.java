package ai.cv.composer.draft;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Source material for one CV draft.
 */
public record DraftRequest(String sourceText, Optional<String> extraInfo, String cvFormat, String language) {

    public DraftRequest {
        sourceText = Objects.requireNonNull(sourceText, "sourceText");
        extraInfo = extraInfo == null ? Optional.empty() : extraInfo.filter(value -> !value.isBlank()).map(String::strip);
        cvFormat = cvFormat == null || cvFormat.isBlank() ? "europass" : cvFormat.strip().toLowerCase(Locale.ROOT);
        language = language == null || language.isBlank() ? "English" : language.strip();
    }

    public static DraftRequest of(String sourceText) {
        return new DraftRequest(sourceText, Optional.empty(), null, null);
    }
}
