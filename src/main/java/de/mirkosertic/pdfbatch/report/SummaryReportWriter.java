package de.mirkosertic.pdfbatch.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import de.mirkosertic.pdfbatch.batch.BatchSummary;
import de.mirkosertic.pdfbatch.config.BuildInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes a {@link BatchSummary} as a JSON document.
 */
public class SummaryReportWriter {

    private static final Logger logger = LoggerFactory.getLogger(SummaryReportWriter.class);

    private final ObjectMapper objectMapper;

    public SummaryReportWriter() {
        final SimpleModule pathModule = new SimpleModule("paths");
        pathModule.addSerializer(Path.class, ToStringSerializer.instance);
        this.objectMapper = new ObjectMapper()
                .registerModule(pathModule)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public void write(final BatchSummary summary, final Path reportFile) throws IOException {
        final Path parent = reportFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (final Writer writer = Files.newBufferedWriter(reportFile)) {
            write(summary, writer);
        }
        logger.info("Summary report written to {}", reportFile);
    }

    public void write(final BatchSummary summary, final Writer writer) throws IOException {
        final Map<String, Object> document = new LinkedHashMap<>();
        document.put("generator", "pdf-batch-converter " + BuildInfo.getVersion());
        document.put("startedAt", Instant.ofEpochMilli(summary.startTimeMs()).toString());
        document.put("finishedAt", Instant.ofEpochMilli(summary.endTimeMs()).toString());
        document.put("summary", summary);
        objectMapper.writeValue(writer, document);
    }
}
