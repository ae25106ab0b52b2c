package ai.cv.composer.cli;

import ai.cv.composer.compose.Composition;
import ai.cv.composer.compose.DocumentComposer;
import ai.cv.composer.config.Config;
import ai.cv.composer.config.ConfigLoader;
import ai.cv.composer.config.EnvironmentReader;
import ai.cv.composer.config.GeneratorConfig;
import ai.cv.composer.config.Secrets;
import ai.cv.composer.draft.ChatModelCvAdvisor;
import ai.cv.composer.draft.ChatModelDraftGenerator;
import ai.cv.composer.draft.CvAdvisor;
import ai.cv.composer.draft.DraftGenerationException;
import ai.cv.composer.draft.DraftGenerator;
import ai.cv.composer.draft.DraftGeneratorFactory;
import ai.cv.composer.draft.DraftRequest;
import ai.cv.composer.draft.DraftService;
import ai.cv.composer.draft.MockCvAdvisor;
import ai.cv.composer.draft.MockDraftGenerator;
import ai.cv.composer.draft.PassThroughDraftGenerator;
import ai.cv.composer.logging.LoggingConfigurator;
import ai.cv.composer.render.PlainTextExporter;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader, draft stage and layout pipeline.
 */
public class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);
    private static final String MDC_DOCUMENT = "document";
    private static final int EXIT_FAILURE = 1;

    private final ConfigLoader configLoader;
    private final DocumentComposer documentComposer;
    private final PlainTextExporter exporter;
    private final PrintWriter out;

    public CliApplication() {
        this(new ConfigLoader(EnvironmentReader.system()), new DocumentComposer(), new PlainTextExporter(),
                new PrintWriter(System.out, true, StandardCharsets.UTF_8));
    }

    CliApplication(ConfigLoader configLoader, DocumentComposer documentComposer, PlainTextExporter exporter,
                   PrintWriter out) {
        this.configLoader = configLoader;
        this.documentComposer = documentComposer;
        this.exporter = exporter;
        this.out = out;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(out);
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(out);
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException | IllegalStateException ex) {
            commandLine.getErr().println(ex.getMessage());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        LoggingConfigurator.configure(config.logFormat());

        MDC.put(MDC_DOCUMENT, String.valueOf(config.inputPath().getFileName()));
        try {
            return compose(config);
        } catch (UncheckedIOException | DraftGenerationException ex) {
            LOGGER.error("Failed to compose {}: {}", config.inputPath(), ex.getMessage(), ex);
            return EXIT_FAILURE;
        } finally {
            MDC.remove(MDC_DOCUMENT);
        }
    }

    private int compose(Config config) {
        LOGGER.info("Running {} for {} ({} format, {}, draft mode {}, page size {})", config.action(), config.inputPath(),
                config.cvFormat(), config.language(), config.draftMode(), config.pageSize());
        String sourceText = readFile(config.inputPath());
        Optional<String> extraInfo = config.extraInfoPath().map(this::readFile);
        DraftRequest request = new DraftRequest(sourceText, extraInfo, config.cvFormat(), config.language());

        String result = createDraftService(config).perform(config.action(), request, config.draftMode());
        if (config.action().producesLayout()) {
            Composition composition = documentComposer.compose(result, config.pageSize().geometry());
            emit(config, exporter.export(composition.document()));
            LOGGER.info("Laid out {} page(s)", composition.document().pageCount());
        } else {
            emit(config, result + System.lineSeparator());
        }
        return 0;
    }

    private void emit(Config config, String content) {
        if (config.outputPath().isPresent()) {
            Path target = config.outputPath().get();
            writeFile(target, content);
            LOGGER.info("Wrote {} result to {}", config.action(), target);
        } else {
            out.print(content);
            out.flush();
        }
    }

    private DraftService createDraftService(Config config) {
        GeneratorConfig generatorConfig = config.generatorConfig();
        ProductionModel production = new ProductionModel(config);
        DraftGeneratorFactory factory = new DraftGeneratorFactory(production, new PassThroughDraftGenerator(),
                new MockDraftGenerator(), production, new MockCvAdvisor());
        return new DraftService(factory, generatorConfig.maxRetryAttempts(),
                generatorConfig.initialBackoffSeconds(), generatorConfig.maxBackoffSeconds(), 0.3);
    }

    protected ChatModel createChatModel(Config config) {
        GeneratorConfig generatorConfig = config.generatorConfig();
        return switch (generatorConfig.provider()) {
            case OLLAMA -> createOllamaChatModel(generatorConfig);
            case GEMINI -> createGeminiChatModel(generatorConfig, config.secrets());
        };
    }

    private ChatModel createOllamaChatModel(GeneratorConfig generatorConfig) {
        try {
            String baseUrl = generatorConfig.baseUrl()
                    .orElseThrow(() -> new IllegalStateException("OLLAMA_BASE_URL must be configured when LLM_PROVIDER=ollama"));
            LOGGER.info("Using Ollama model '{}' via {}", generatorConfig.modelName(), baseUrl);
            return OllamaChatModel.builder()
                    .baseUrl(baseUrl)
                    .modelName(generatorConfig.modelName())
                    .temperature(0.2)
                    .timeout(Duration.ofMinutes(2))
                    .build();
        } catch (RuntimeException ex) {
            throw new DraftGenerationException("Failed to initialize Ollama chat model", ex);
        }
    }

    private ChatModel createGeminiChatModel(GeneratorConfig generatorConfig, Secrets secrets) {
        String apiKey = secrets.geminiApiKey()
                .filter(value -> !value.isBlank())
                .orElseThrow(() -> new DraftGenerationException("GEMINI_API_KEY must be provided when LLM_PROVIDER=gemini", null));
        try {
            LOGGER.info("Using Gemini model '{}'", generatorConfig.modelName());
            return GoogleAiGeminiChatModel.builder()
                    .apiKey(apiKey)
                    .modelName(generatorConfig.modelName())
                    .temperature(0.2)
                    .timeout(Duration.ofMinutes(2))
                    .build();
        } catch (RuntimeException ex) {
            throw new DraftGenerationException("Failed to initialize Gemini chat model", ex);
        }
    }

    /**
     * Creates the remote chat model on first use, so offline modes never contact a provider.
     */
    private final class ProductionModel implements DraftGenerator, CvAdvisor {

        private final Config config;
        private ChatModel chatModel;
        private ChatModelDraftGenerator generator;
        private ChatModelCvAdvisor advisor;

        ProductionModel(Config config) {
            this.config = config;
        }

        @Override
        public String generate(DraftRequest request) {
            if (generator == null) {
                generator = new ChatModelDraftGenerator(chatModel(), providerName(), modelName());
            }
            return generator.generate(request);
        }

        @Override
        public String review(DraftRequest request) {
            return advisor().review(request);
        }

        @Override
        public String missingInformation(DraftRequest request) {
            return advisor().missingInformation(request);
        }

        private ChatModelCvAdvisor advisor() {
            if (advisor == null) {
                advisor = new ChatModelCvAdvisor(chatModel(), providerName(), modelName());
            }
            return advisor;
        }

        private ChatModel chatModel() {
            if (chatModel == null) {
                chatModel = createChatModel(config);
            }
            return chatModel;
        }

        private String providerName() {
            return config.generatorConfig().provider().name();
        }

        private String modelName() {
            return config.generatorConfig().modelName();
        }
    }

    private String readFile(Path path) {
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read " + path, ex);
        }
    }

    private void writeFile(Path target, String content) {
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, content, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write " + target, ex);
        }
    }
}
