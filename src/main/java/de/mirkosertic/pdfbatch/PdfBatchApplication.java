package de.mirkosertic.pdfbatch;

import de.mirkosertic.pdfbatch.batch.BatchCoordinator;
import de.mirkosertic.pdfbatch.batch.BatchHandle;
import de.mirkosertic.pdfbatch.batch.BatchListener;
import de.mirkosertic.pdfbatch.batch.BatchSummary;
import de.mirkosertic.pdfbatch.config.ApplicationConfig;
import de.mirkosertic.pdfbatch.config.BuildInfo;
import de.mirkosertic.pdfbatch.config.LoggingConfigurator;
import de.mirkosertic.pdfbatch.engine.ConversionEngine;
import de.mirkosertic.pdfbatch.engine.ConversionException;
import de.mirkosertic.pdfbatch.engine.LibreOfficeEngine;
import de.mirkosertic.pdfbatch.input.FilePatternMatcher;
import de.mirkosertic.pdfbatch.input.InputCollector;
import de.mirkosertic.pdfbatch.naming.NamingRule;
import de.mirkosertic.pdfbatch.report.SummaryReportWriter;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command line entry point: converts the given documents and directories into one output directory.
 */
@Command(
        name = "pdf-batch-converter",
        mixinStandardHelpOptions = true,
        exitCodeOnInvalidInput = PdfBatchApplication.EXIT_ERROR,
        versionProvider = PdfBatchApplication.VersionProvider.class,
        description = "Convert office documents to PDF using several LibreOffice instances in parallel"
)
public class PdfBatchApplication implements Callable<Integer> {

    private static final Logger logger = LoggerFactory.getLogger(PdfBatchApplication.class);

    static final int EXIT_ALL_CONVERTED = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_INCOMPLETE = 2;

    @Parameters(index = "0", description = "Output directory, created if missing")
    private Path outputDirectory;

    @Parameters(index = "1..*", arity = "1..*", description = "Documents or directories to convert")
    private List<Path> inputs;

    @Option(names = {"-w", "--workers"}, description = "Number of parallel workers (default: from configuration)")
    private @Nullable Integer workers;

    @Option(names = {"-n", "--naming-rule"},
            description = "Output naming rule: ORIGINAL_NAME or REMOVE_SQUARE_BRACKETS (default: from configuration)")
    private @Nullable String namingRule;

    @Option(names = {"-r", "--report"}, description = "Write the batch summary as JSON to this file")
    private @Nullable Path reportFile;

    private final ApplicationConfig config;
    private final ConversionEngine engine;

    public PdfBatchApplication(final ApplicationConfig config, final ConversionEngine engine) {
        this.config = config;
        this.engine = engine;
    }

    @Override
    public Integer call() throws IOException, InterruptedException {
        if (workers != null && workers < 1) {
            logger.error("--workers must be at least 1, got {}", workers);
            return EXIT_ERROR;
        }
        final NamingRule rule = namingRule == null ? config.getNamingRule() : NamingRule.fromConfig(namingRule);
        final int workerCount = workers == null ? config.getWorkerCount() : workers;

        final InputCollector collector = new InputCollector(new FilePatternMatcher(config.getIncludePatterns()));
        final List<Path> sources = collector.collect(inputs);

        final BatchListener listener = config.isNotificationsEnabled() ? new NotificationService() : BatchListener.NONE;
        final BatchCoordinator coordinator = new BatchCoordinator(config, engine, listener);

        final BatchHandle batch;
        try {
            batch = coordinator.start(sources, outputDirectory, rule, workerCount);
        } catch (final ConversionException e) {
            logger.error("{}: {}", e.getReason().getLabel(), e.getMessage());
            return EXIT_ERROR;
        }

        final Thread shutdownHook = new Thread(coordinator::shutdown, "shutdown-hook");
        Runtime.getRuntime().addShutdownHook(shutdownHook);

        final BatchSummary summary = batch.awaitCompletion();
        try {
            Runtime.getRuntime().removeShutdownHook(shutdownHook);
        } catch (final IllegalStateException e) {
            logger.debug("JVM is already shutting down");
        }

        if (reportFile != null) {
            new SummaryReportWriter().write(summary, reportFile);
        }
        return exitCodeFor(summary);
    }

    static int exitCodeFor(final BatchSummary summary) {
        return summary.allConverted() ? EXIT_ALL_CONVERTED : EXIT_INCOMPLETE;
    }

    static CommandLine commandLine(final ApplicationConfig config, final ConversionEngine engine) {
        final CommandLine commandLine = new CommandLine(new PdfBatchApplication(config, engine));
        commandLine.setExecutionExceptionHandler((e, cmd, parseResult) -> {
            logger.error("Batch conversion failed", e);
            return EXIT_ERROR;
        });
        return commandLine;
    }

    public static void main(final String[] args) {
        // Configure logging FIRST, before any other code that might log
        final boolean backgroundMode = "background".equalsIgnoreCase(System.getProperty("profile"));
        final Path logFile = LoggingConfigurator.configure(backgroundMode, ApplicationConfig.getLogDirectory());

        final int exitCode;
        try {
            final ApplicationConfig config = ApplicationConfig.load();
            logger.info("PDF Batch Converter {} (built {})", BuildInfo.getVersion(), BuildInfo.getBuildTimestamp());
            if (logFile != null) {
                logger.info("Logging to {}", logFile);
            }
            final ConversionEngine engine = new LibreOfficeEngine(config.getSofficePath(), config.getTargetFormat());
            exitCode = commandLine(config, engine).execute(args);
        } catch (final IllegalArgumentException e) {
            System.err.println("Invalid configuration: " + e.getMessage());
            System.exit(EXIT_ERROR);
            return;
        }
        System.exit(exitCode);
    }

    static final class VersionProvider implements CommandLine.IVersionProvider {
        @Override
        public String[] getVersion() {
            return new String[]{"pdf-batch-converter " + BuildInfo.getVersion() + " (" + BuildInfo.getBuildTimestamp() + ")"};
        }
    }
}
