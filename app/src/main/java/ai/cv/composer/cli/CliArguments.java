package ai.cv.composer.cli;

import ai.cv.composer.config.LogFormat;
import ai.cv.composer.draft.CvAction;
import ai.cv.composer.draft.DraftMode;
import ai.cv.composer.render.PageSize;
import java.nio.file.Path;
import picocli.CommandLine;

@CommandLine.Command(name = "ai-cv-composer", mixinStandardHelpOptions = true,
        description = "Lays out CV markup (optionally drafted by a language model) as paginated text")
public class CliArguments {

    @CommandLine.Option(names = "--input", required = true, description = "CV text or markup file", paramLabel = "FILE")
    private Path inputPath;

    @CommandLine.Option(names = "--extra-info", description = "Additional details passed to the draft stage", paramLabel = "FILE")
    private Path extraInfoPath;

    @CommandLine.Option(names = "--output", description = "Write the laid out document to this file instead of stdout", paramLabel = "FILE")
    private Path outputPath;

    @CommandLine.Option(names = "--format", description = "Target CV format, e.g. europass", paramLabel = "NAME")
    private String cvFormat;

    @CommandLine.Option(names = "--language", description = "Target CV language", paramLabel = "NAME")
    private String language;

    @CommandLine.Option(names = "--action", description = "What to produce: draft, review, or missing-info", converter = OptionConverters.CvActionConverter.class)
    private CvAction action;

    @CommandLine.Option(names = "--draft-mode", description = "Draft mode: production, pass-through, or mock", converter = OptionConverters.DraftModeConverter.class)
    private DraftMode draftMode;

    @CommandLine.Option(names = "--page-size", description = "Page size: a4 or letter", converter = OptionConverters.PageSizeConverter.class)
    private PageSize pageSize;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = OptionConverters.LogFormatConverter.class)
    private LogFormat logFormat;

    public Path inputPath() {
        return inputPath;
    }

    public Path extraInfoPath() {
        return extraInfoPath;
    }

    public Path outputPath() {
        return outputPath;
    }

    public String cvFormat() {
        return cvFormat;
    }

    public String language() {
        return language;
    }

    public CvAction action() {
        return action;
    }

    public DraftMode draftMode() {
        return draftMode;
    }

    public PageSize pageSize() {
        return pageSize;
    }

    public LogFormat logFormat() {
        return logFormat;
    }
}
