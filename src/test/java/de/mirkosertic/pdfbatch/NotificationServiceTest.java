package de.mirkosertic.pdfbatch;

import de.mirkosertic.pdfbatch.batch.BatchSummary;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("NotificationService Tests")
class NotificationServiceTest {

    private static final Path OUT = Path.of("out");

    @Test
    @DisplayName("Should report a fully converted batch")
    void shouldDescribeCompleteBatch() {
        final BatchSummary summary = new BatchSummary(5, 4, 1, 0, 0, false, OUT, 0, 10, List.of());

        assertThat(NotificationService.titleFor(summary)).isEqualTo("PDF conversion finished");
        assertThat(NotificationService.messageFor(summary)).isEqualTo("5 of 5 file(s) converted, 1 renamed");
    }

    @Test
    @DisplayName("Should mention failures and unprocessed files")
    void shouldDescribeIncompleteBatch() {
        final BatchSummary failed = new BatchSummary(4, 2, 0, 2, 0, false, OUT, 0, 10, List.of());
        final BatchSummary stopped = new BatchSummary(4, 1, 0, 1, 2, true, OUT, 0, 10, List.of());

        assertThat(NotificationService.titleFor(failed)).isEqualTo("PDF conversion finished with errors");
        assertThat(NotificationService.messageFor(failed)).isEqualTo("2 of 4 file(s) converted, 2 failed");
        assertThat(NotificationService.titleFor(stopped)).isEqualTo("PDF conversion stopped");
        assertThat(NotificationService.messageFor(stopped))
                .isEqualTo("1 of 4 file(s) converted, 1 failed, 2 not processed");
    }
}
