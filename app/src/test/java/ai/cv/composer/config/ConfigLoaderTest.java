package ai.cv.composer.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import ai.cv.composer.cli.CliArguments;
import ai.cv.composer.draft.CvAction;
import ai.cv.composer.draft.DraftMode;
import ai.cv.composer.render.PageSize;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

class ConfigLoaderTest {

    @Test
    void assemblesConfigFromCliArguments() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--input", "cv.md",
                "--extra-info", "extra.txt",
                "--output", "out/cv.txt",
                "--format", "modern",
                "--language", "Slovak",
                "--draft-mode", "mock",
                "--page-size", "letter",
                "--log-format", "json");

        Config config = new ConfigLoader(key -> Optional.empty()).load(cliArguments);

        assertThat(config.inputPath()).isEqualTo(Path.of("cv.md"));
        assertThat(config.extraInfoPath()).contains(Path.of("extra.txt"));
        assertThat(config.outputPath()).contains(Path.of("out/cv.txt"));
        assertThat(config.cvFormat()).isEqualTo("modern");
        assertThat(config.language()).isEqualTo("Slovak");
        assertThat(config.draftMode()).isEqualTo(DraftMode.MOCK);
        assertThat(config.pageSize()).isEqualTo(PageSize.LETTER);
        assertThat(config.logFormat()).isEqualTo(LogFormat.JSON);
        assertThat(config.generatorConfig().provider()).isEqualTo(LlmProvider.OLLAMA);
        assertThat(config.generatorConfig().baseUrl()).contains("http://localhost:11434");
        assertThat(config.secrets().geminiApiKey()).isEmpty();
    }

    @Test
    void fallsBackToEnvironmentValuesWhenCliOmitted() {
        Map<String, String> envValues = new HashMap<>();
        envValues.put(ConfigLoader.ENV_CV_FORMAT, "chronological");
        envValues.put(ConfigLoader.ENV_CV_LANGUAGE, "German");
        envValues.put(ConfigLoader.ENV_DRAFT_MODE, "production");
        envValues.put(ConfigLoader.ENV_PAGE_SIZE, "A4");
        envValues.put(ConfigLoader.ENV_LOG_FORMAT, "json");
        envValues.put(ConfigLoader.ENV_LLM_PROVIDER, "gemini");
        envValues.put(ConfigLoader.ENV_LLM_MODEL, "gemini-2.0-flash");
        envValues.put(ConfigLoader.ENV_GEMINI_API_KEY, "secret");
        envValues.put(ConfigLoader.ENV_LLM_MAX_RETRY_ATTEMPTS, "7");

        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "--input", "cv.md");
        Config config = new ConfigLoader(key -> Optional.ofNullable(envValues.get(key))).load(cliArguments);

        assertThat(config.cvFormat()).isEqualTo("chronological");
        assertThat(config.language()).isEqualTo("German");
        assertThat(config.draftMode()).isEqualTo(DraftMode.PRODUCTION);
        assertThat(config.pageSize()).isEqualTo(PageSize.A4);
        assertThat(config.logFormat()).isEqualTo(LogFormat.JSON);
        assertThat(config.generatorConfig().provider()).isEqualTo(LlmProvider.GEMINI);
        assertThat(config.generatorConfig().modelName()).isEqualTo("gemini-2.0-flash");
        assertThat(config.generatorConfig().baseUrl()).isEmpty();
        assertThat(config.generatorConfig().maxRetryAttempts()).isEqualTo(7);
        assertThat(config.secrets().geminiApiKey()).contains("secret");
        assertThat(config.secrets().toString()).doesNotContain("secret");
    }

    @Test
    void cliValuesOverrideEnvironment() {
        Map<String, String> envValues = Map.of(
                ConfigLoader.ENV_DRAFT_MODE, "production",
                ConfigLoader.ENV_CV_LANGUAGE, "German");

        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--input", "cv.md", "--draft-mode", "pass-through", "--language", "French");
        Config config = new ConfigLoader(key -> Optional.ofNullable(envValues.get(key))).load(cliArguments);

        assertThat(config.draftMode()).isEqualTo(DraftMode.PASS_THROUGH);
        assertThat(config.language()).isEqualTo("French");
    }

    @Test
    void appliesDefaults() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "--input", "cv.md");

        Config config = new ConfigLoader(key -> Optional.empty()).load(cliArguments);

        assertThat(config.cvFormat()).isEqualTo("europass");
        assertThat(config.language()).isEqualTo("English");
        assertThat(config.action()).isEqualTo(CvAction.DRAFT);
        assertThat(config.draftMode()).isEqualTo(DraftMode.PASS_THROUGH);
        assertThat(config.pageSize()).isEqualTo(PageSize.A4);
        assertThat(config.logFormat()).isEqualTo(LogFormat.TEXT);
        assertThat(config.generatorConfig().modelName()).isEqualTo("llama3.1:8b");
        assertThat(config.generatorConfig().maxRetryAttempts()).isEqualTo(4);
        assertThat(config.generatorConfig().initialBackoffSeconds()).isEqualTo(2);
        assertThat(config.generatorConfig().maxBackoffSeconds()).isEqualTo(30);
    }

    @Test
    void requiresInputFile() {
        CliArguments cliArguments = new CliArguments();

        Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> Optional.empty()).load(cliArguments));

        assertThat(thrown).isInstanceOf(IllegalArgumentException.class).hasMessageContaining("input");
    }

    @Test
    void requiresGeminiKeyForProductionDrafts() {
        Map<String, String> envValues = Map.of(ConfigLoader.ENV_LLM_PROVIDER, "gemini");
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--input", "cv.md", "--draft-mode", "production");

        Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> Optional.ofNullable(envValues.get(key))).load(cliArguments));

        assertThat(thrown).isInstanceOf(IllegalStateException.class).hasMessageContaining("GEMINI_API_KEY");
    }

    @Test
    void rejectsInvalidRetryAttempts() {
        Map<String, String> envValues = Map.of(ConfigLoader.ENV_LLM_MAX_RETRY_ATTEMPTS, "many");
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "--input", "cv.md");

        Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> Optional.ofNullable(envValues.get(key))).load(cliArguments));

        assertThat(thrown).isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(ConfigLoader.ENV_LLM_MAX_RETRY_ATTEMPTS);
    }

    @Test
    void readsActionFromCliOrEnvironment() {
        Map<String, String> envValues = Map.of(
                ConfigLoader.ENV_CV_ACTION, "missing-info",
                ConfigLoader.ENV_DRAFT_MODE, "mock");
        EnvironmentReader environment = key -> Optional.ofNullable(envValues.get(key));

        Config fromEnvironment = new ConfigLoader(environment)
                .load(CommandLine.populateCommand(new CliArguments(), "--input", "cv.md"));
        Config fromCli = new ConfigLoader(environment)
                .load(CommandLine.populateCommand(new CliArguments(), "--input", "cv.md", "--action", "review"));

        assertThat(fromEnvironment.action()).isEqualTo(CvAction.MISSING_INFO);
        assertThat(fromCli.action()).isEqualTo(CvAction.REVIEW);
    }

    @Test
    void feedbackActionsNeedAModelOrMock() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--input", "cv.md", "--action", "review");

        Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> Optional.empty()).load(cliArguments));

        assertThat(thrown).isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("review")
                .hasMessageContaining("--draft-mode");
    }

    @Test
    void ignoresBlankEnvironmentValues() {
        Map<String, String> envValues = Map.of(
                ConfigLoader.ENV_PAGE_SIZE, "  ",
                ConfigLoader.ENV_LLM_MODEL, "",
                ConfigLoader.ENV_LLM_PROVIDER, " gemini ",
                ConfigLoader.ENV_GEMINI_API_KEY, " key ");

        Config config = new ConfigLoader(key -> Optional.ofNullable(envValues.get(key)))
                .load(CommandLine.populateCommand(new CliArguments(), "--input", "cv.md"));

        assertThat(config.pageSize()).isEqualTo(PageSize.A4);
        assertThat(config.generatorConfig().provider()).isEqualTo(LlmProvider.GEMINI);
        assertThat(config.generatorConfig().modelName()).isEqualTo("gemini-1.5-flash");
        assertThat(config.secrets().geminiApiKey()).contains("key");
    }
}
