package ai.cv.composer.cli;

import ai.cv.composer.config.LogFormat;
import ai.cv.composer.draft.CvAction;
import ai.cv.composer.draft.DraftMode;
import ai.cv.composer.render.PageSize;
import java.util.Arrays;
import java.util.Locale;
import java.util.function.Function;
import java.util.stream.Collectors;
import picocli.CommandLine;

/**
 * picocli converters for the enum-valued options. Rejected values are reported with the accepted spellings.
 */
public final class OptionConverters {

    private OptionConverters() {
    }

    public abstract static class NamedValueConverter<E extends Enum<E>> implements CommandLine.ITypeConverter<E> {

        private final Class<E> type;
        private final Function<String, E> parser;

        NamedValueConverter(Class<E> type, Function<String, E> parser) {
            this.type = type;
            this.parser = parser;
        }

        @Override
        public E convert(String value) {
            try {
                return parser.apply(value);
            } catch (IllegalArgumentException ex) {
                throw new CommandLine.TypeConversionException(
                        "'%s' is not one of %s".formatted(value, acceptedNames()));
            }
        }

        private String acceptedNames() {
            return Arrays.stream(type.getEnumConstants())
                    .map(constant -> constant.name().toLowerCase(Locale.ROOT).replace('_', '-'))
                    .collect(Collectors.joining(", "));
        }
    }

    public static final class CvActionConverter extends NamedValueConverter<CvAction> {
        public CvActionConverter() {
            super(CvAction.class, CvAction::from);
        }
    }

    public static final class DraftModeConverter extends NamedValueConverter<DraftMode> {
        public DraftModeConverter() {
            super(DraftMode.class, DraftMode::from);
        }
    }

    public static final class PageSizeConverter extends NamedValueConverter<PageSize> {
        public PageSizeConverter() {
            super(PageSize.class, PageSize::from);
        }
    }

    public static final class LogFormatConverter extends NamedValueConverter<LogFormat> {
        public LogFormatConverter() {
            super(LogFormat.class, LogFormat::from);
        }
    }
}
