package ai.catalog.translator.cli;

import ai.catalog.translator.catalog.CatalogSource;
import ai.catalog.translator.catalog.CatalogTransformer;
import ai.catalog.translator.catalog.PropertiesCatalogTransformer;
import ai.catalog.translator.catalog.StaticRuleProvider;
import ai.catalog.translator.config.Config;
import ai.catalog.translator.config.ConfigLoader;
import ai.catalog.translator.config.SystemEnvironmentReader;
import ai.catalog.translator.logging.LoggingConfigurator;
import ai.catalog.translator.model.SourceText;
import ai.catalog.translator.model.TranslationOutput;
import ai.catalog.translator.model.TranslationRequest;
import ai.catalog.translator.model.TranslationResult;
import ai.catalog.translator.pipeline.TranslationPipeline;
import ai.catalog.translator.pipeline.TranslationStream;
import ai.catalog.translator.plugin.PluginRegistry;
import ai.catalog.translator.plugins.DiffTrackingPlugin;
import ai.catalog.translator.plugins.GlossaryPlugin;
import ai.catalog.translator.plugins.MultiProviderPlugin;
import ai.catalog.translator.plugins.PiiMaskingPlugin;
import ai.catalog.translator.plugins.ProgressLoggingObserver;
import ai.catalog.translator.plugins.PromptPlugin;
import ai.catalog.translator.plugins.StylePlugin;
import ai.catalog.translator.plugins.TokenChunkingPlugin;
import ai.catalog.translator.plugins.TranslationContextPlugin;
import ai.catalog.translator.plugins.ValidationPlugin;
import ai.catalog.translator.translate.BackendFactory;
import ai.catalog.translator.translate.TranslationException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and translation pipeline.
 * Translates the missing keys of {@code <name>_<locale>.properties} for every target locale.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);
    private static final String CATALOG_EXTENSION = ".properties";

    private final ConfigLoader configLoader;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()));
    }

    CliApplication(ConfigLoader configLoader) {
        this.configLoader = Objects.requireNonNull(configLoader, "configLoader");
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
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException ex) {
            commandLine.getErr().println(ex.getMessage());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        LoggingConfigurator.configure(config.logFormat());
        LOGGER.info("Translating {} from {} to {} ({} mode, providers {})", config.source(), config.sourceLocale(),
                config.targetLocales(), config.translationMode(), config.providers());
        if (config.translationMode().offline()) {
            LOGGER.info("Offline {} run; no vendor will be contacted", config.translationMode());
        }

        try {
            return translate(config);
        } catch (TranslationException ex) {
            LOGGER.error("Translation failed: {}", ex.getMessage());
            return 1;
        }
    }

    private int translate(Config config) {
        Map<String, String> sourceEntries = PropertiesCatalogTransformer.read(config.source());
        if (sourceEntries.isEmpty()) {
            LOGGER.warn("Source catalog {} has no entries", config.source());
            return 0;
        }
        String baseName = baseName(config.source(), config.sourceLocale());
        Map<String, CatalogTransformer> catalogs = new ConcurrentHashMap<>();
        Function<String, CatalogTransformer> catalogFor = locale -> catalogs.computeIfAbsent(locale,
                key -> new PropertiesCatalogTransformer(config.outputDirectory().resolve(baseName + "_" + key + CATALOG_EXTENSION)));
        CatalogSource catalogSource = locale -> Optional.of(catalogFor.apply(locale));

        BackendFactory backends = new BackendFactory(config.translationMode(), config.secrets(), config.ollamaBaseUrl());
        try (MultiProviderPlugin multiProvider = new MultiProviderPlugin(backends::select)) {
            PluginRegistry registry = new PluginRegistry()
                    .register(new PiiMaskingPlugin())
                    .register(new DiffTrackingPlugin(catalogSource))
                    .register(new PromptPlugin())
                    .register(new StylePlugin())
                    .register(new GlossaryPlugin(StaticRuleProvider.empty()))
                    .register(new TranslationContextPlugin(catalogSource))
                    .register(new TokenChunkingPlugin())
                    .register(multiProvider)
                    .register(new ValidationPlugin())
                    .register(new ProgressLoggingObserver());
            TranslationPipeline pipeline = TranslationPipeline.builder(registry).build();

            Map<String, SourceText> texts = new LinkedHashMap<>();
            sourceEntries.forEach((key, value) -> texts.put(key, SourceText.of(value)));
            TranslationRequest request = new TranslationRequest(config.sourceLocale(), config.targetLocales(), texts,
                    Map.of(),
                    Map.of(TranslationRequest.METADATA_FILENAME, config.source().getFileName().toString(),
                            TranslationRequest.METADATA_REQUEST_ID, TranslationRequest.newRequestId()),
                    config.tenant(),
                    config.pluginConfigs());

            TranslationResult result;
            try (TranslationStream stream = pipeline.process(request)) {
                while (stream.hasNext()) {
                    TranslationOutput output = stream.next();
                    if (!output.cached()) {
                        catalogFor.apply(output.locale()).updateString(output.key(), output.value());
                    }
                }
                result = stream.result();
            }
            config.targetLocales().forEach(locale -> {
                CatalogTransformer catalog = catalogs.get(locale);
                if (catalog != null) {
                    catalog.save();
                }
            });
            if (!result.errors().isEmpty()) {
                result.errors().forEach(error -> LOGGER.error("{}", error));
                return 1;
            }
            return 0;
        }
    }

    static String baseName(Path source, String sourceLocale) {
        String fileName = source.getFileName().toString();
        String name = fileName.endsWith(CATALOG_EXTENSION)
                ? fileName.substring(0, fileName.length() - CATALOG_EXTENSION.length())
                : fileName;
        String localeSuffix = "_" + sourceLocale;
        if (name.endsWith(localeSuffix) && name.length() > localeSuffix.length()) {
            return name.substring(0, name.length() - localeSuffix.length());
        }
        return name;
    }
}
