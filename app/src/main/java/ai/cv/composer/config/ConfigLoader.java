package ai.cv.composer.config;

import ai.cv.composer.cli.CliArguments;
import ai.cv.composer.draft.CvAction;
import ai.cv.composer.draft.DraftMode;
import ai.cv.composer.render.PageSize;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 * CLI values win over environment values, which win over defaults.
 */
public class ConfigLoader {

    static final String ENV_CV_FORMAT = "CV_FORMAT";
    static final String ENV_CV_LANGUAGE = "CV_LANGUAGE";
    static final String ENV_CV_ACTION = "CV_ACTION";
    static final String ENV_DRAFT_MODE = "DRAFT_MODE";
    static final String ENV_PAGE_SIZE = "PAGE_SIZE";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";
    static final String ENV_LLM_PROVIDER = "LLM_PROVIDER";
    static final String ENV_LLM_MODEL = "LLM_MODEL";
    static final String ENV_OLLAMA_BASE_URL = "OLLAMA_BASE_URL";
    static final String ENV_GEMINI_API_KEY = "GEMINI_API_KEY";
    static final String ENV_LLM_MAX_RETRY_ATTEMPTS = "LLM_MAX_RETRY_ATTEMPTS";
    static final String ENV_LLM_INITIAL_BACKOFF_SECONDS = "LLM_INITIAL_BACKOFF_SECONDS";
    static final String ENV_LLM_MAX_BACKOFF_SECONDS = "LLM_MAX_BACKOFF_SECONDS";

    private static final String DEFAULT_CV_FORMAT = "europass";
    private static final String DEFAULT_LANGUAGE = "English";
    private static final String DEFAULT_OLLAMA_BASE_URL = "http://localhost:11434";
    private static final int DEFAULT_LLM_MAX_RETRY_ATTEMPTS = 4;
    private static final int DEFAULT_LLM_INITIAL_BACKOFF_SECONDS = 2;
    private static final int DEFAULT_LLM_MAX_BACKOFF_SECONDS = 30;

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        Path inputPath = Optional.ofNullable(arguments.inputPath())
                .orElseThrow(() -> new IllegalArgumentException("input file must be provided"));

        String cvFormat = firstNonBlank(arguments.cvFormat(), ENV_CV_FORMAT, DEFAULT_CV_FORMAT);
        String language = firstNonBlank(arguments.language(), ENV_CV_LANGUAGE, DEFAULT_LANGUAGE);
        CvAction action = resolveAction(arguments);
        DraftMode draftMode = resolveDraftMode(arguments);
        if (!action.producesLayout() && draftMode == DraftMode.PASS_THROUGH) {
            throw new IllegalArgumentException("action " + action.name().toLowerCase(Locale.ROOT).replace('_', '-')
                    + " needs --draft-mode production or mock");
        }
        PageSize pageSize = resolvePageSize(arguments);
        LogFormat logFormat = resolveLogFormat(arguments);

        LlmProvider provider = environmentReader.nonBlank(ENV_LLM_PROVIDER)
                .map(LlmProvider::from)
                .orElse(LlmProvider.OLLAMA);
        String modelName = environmentReader.nonBlank(ENV_LLM_MODEL).orElse(provider.defaultModel());

        Optional<String> baseUrl = Optional.empty();
        if (provider == LlmProvider.OLLAMA) {
            baseUrl = Optional.of(environmentReader.nonBlank(ENV_OLLAMA_BASE_URL).orElse(DEFAULT_OLLAMA_BASE_URL));
        }

        int maxRetryAttempts = readPositiveInteger(ENV_LLM_MAX_RETRY_ATTEMPTS, DEFAULT_LLM_MAX_RETRY_ATTEMPTS);
        int initialBackoffSeconds = readPositiveInteger(ENV_LLM_INITIAL_BACKOFF_SECONDS, DEFAULT_LLM_INITIAL_BACKOFF_SECONDS);
        int maxBackoffSeconds = readPositiveInteger(ENV_LLM_MAX_BACKOFF_SECONDS, DEFAULT_LLM_MAX_BACKOFF_SECONDS);

        Optional<String> geminiApiKey = environmentReader.nonBlank(ENV_GEMINI_API_KEY);
        if (draftMode == DraftMode.PRODUCTION && provider.needsApiKey() && geminiApiKey.isEmpty()) {
            throw new IllegalStateException("GEMINI_API_KEY must be provided when LLM_PROVIDER=gemini in production mode");
        }

        GeneratorConfig generatorConfig = new GeneratorConfig(provider, modelName, baseUrl,
                maxRetryAttempts, initialBackoffSeconds, maxBackoffSeconds);
        return new Config(inputPath,
                Optional.ofNullable(arguments.extraInfoPath()),
                Optional.ofNullable(arguments.outputPath()),
                cvFormat, language, action, draftMode, pageSize, logFormat, generatorConfig, new Secrets(geminiApiKey));
    }

    private CvAction resolveAction(CliArguments arguments) {
        CvAction cliAction = arguments.action();
        if (cliAction != null) {
            return cliAction;
        }
        return environmentReader.nonBlank(ENV_CV_ACTION)
                .map(CvAction::from)
                .orElse(CvAction.DRAFT);
    }

    private DraftMode resolveDraftMode(CliArguments arguments) {
        DraftMode cliMode = arguments.draftMode();
        if (cliMode != null) {
            return cliMode;
        }
        return environmentReader.nonBlank(ENV_DRAFT_MODE)
                .map(DraftMode::from)
                .orElse(DraftMode.PASS_THROUGH);
    }

    private PageSize resolvePageSize(CliArguments arguments) {
        PageSize cliSize = arguments.pageSize();
        if (cliSize != null) {
            return cliSize;
        }
        return environmentReader.nonBlank(ENV_PAGE_SIZE)
                .map(PageSize::from)
                .orElse(PageSize.A4);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.nonBlank(ENV_LOG_FORMAT)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private int readPositiveInteger(String envKey, int defaultValue) {
        return environmentReader.nonBlank(envKey)
                .map(raw -> parsePositiveInteger(envKey, raw))
                .orElse(defaultValue);
    }

    private static int parsePositiveInteger(String envKey, String raw) {
        try {
            int value = Integer.parseInt(raw);
            if (value < 1) {
                throw new IllegalArgumentException(envKey + " must be at least 1");
            }
            return value;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(envKey + " must be an integer", ex);
        }
    }

    private String firstNonBlank(String cliValue, String envKey, String defaultValue) {
        if (isNotBlank(cliValue)) {
            return cliValue;
        }
        return environmentReader.nonBlank(envKey).orElse(defaultValue);
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }
}
