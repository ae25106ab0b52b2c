package ai.cv.composer.config;

import ai.cv.composer.draft.CvAction;
import ai.cv.composer.draft.DraftMode;
import ai.cv.composer.render.PageSize;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable representation of the runtime configuration assembled from CLI arguments and environment values.
 */
public record Config(
        Path inputPath,
        Optional<Path> extraInfoPath,
        Optional<Path> outputPath,
        String cvFormat,
        String language,
        CvAction action,
        DraftMode draftMode,
        PageSize pageSize,
        LogFormat logFormat,
        GeneratorConfig generatorConfig,
        Secrets secrets
) {

    public Config {
        Objects.requireNonNull(inputPath, "inputPath");
        extraInfoPath = extraInfoPath == null ? Optional.empty() : extraInfoPath;
        outputPath = outputPath == null ? Optional.empty() : outputPath;
        cvFormat = requireNonBlank(cvFormat, "cvFormat");
        language = requireNonBlank(language, "language");
        action = Objects.requireNonNull(action, "action");
        draftMode = Objects.requireNonNull(draftMode, "draftMode");
        pageSize = Objects.requireNonNull(pageSize, "pageSize");
        logFormat = Objects.requireNonNull(logFormat, "logFormat");
        generatorConfig = Objects.requireNonNull(generatorConfig, "generatorConfig");
        secrets = Objects.requireNonNull(secrets, "secrets");
    }

    private static String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value.strip();
    }
}
