package ai.catalog.translator.cli;

import ai.catalog.translator.config.LogFormat;
import ai.catalog.translator.translate.TranslationMode;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine;

@CommandLine.Command(name = "ai-catalog-translator", mixinStandardHelpOptions = true,
        description = "Translates string catalogs with one or more language models")
public class CliArguments {

    @CommandLine.Option(names = "--source", required = true, description = "Source catalog (.properties)", paramLabel = "FILE")
    private Path source;

    @CommandLine.Option(names = "--source-locale", description = "Locale of the source catalog (default: en)", paramLabel = "LOCALE")
    private String sourceLocale;

    @CommandLine.Option(names = "--target-locale", description = "Locale to translate into; repeatable", paramLabel = "LOCALE")
    private List<String> targetLocales = new ArrayList<>();

    @CommandLine.Option(names = "--output-dir", description = "Directory of the translated catalogs (default: next to the source)", paramLabel = "DIR")
    private Path outputDirectory;

    @CommandLine.Option(names = "--provider", description = "Provider as vendor:model; repeatable", paramLabel = "PROVIDER")
    private List<String> providers = new ArrayList<>();

    @CommandLine.Option(names = "--translation-mode", description = "Translation execution mode: production, dry-run, or mock", converter = TranslationModeOption.class)
    private TranslationMode translationMode;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatOption.class)
    private LogFormat logFormat;

    @CommandLine.Option(names = "--tenant", description = "Tenant whose plugin settings apply", paramLabel = "TENANT")
    private String tenant;

    public Path source() {
        return source;
    }

    public String sourceLocale() {
        return sourceLocale;
    }

    public List<String> targetLocales() {
        return targetLocales;
    }

    public Path outputDirectory() {
        return outputDirectory;
    }

    public List<String> providers() {
        return providers;
    }

    public TranslationMode translationMode() {
        return translationMode;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public String tenant() {
        return tenant;
    }

    static final class TranslationModeOption implements CommandLine.ITypeConverter<TranslationMode> {

        @Override
        public TranslationMode convert(String value) {
            try {
                return TranslationMode.from(value);
            } catch (IllegalArgumentException ex) {
                throw new CommandLine.TypeConversionException(
                        "'%s' is not a translation mode (expected production, dry-run or mock)".formatted(value));
            }
        }
    }

    static final class LogFormatOption implements CommandLine.ITypeConverter<LogFormat> {

        @Override
        public LogFormat convert(String value) {
            try {
                return LogFormat.from(value);
            } catch (IllegalArgumentException ex) {
                throw new CommandLine.TypeConversionException("'%s' is not a log format (expected text or json)".formatted(value));
            }
        }
    }
}
