package de.mirkosertic.pdfbatch;

import de.mirkosertic.pdfbatch.batch.BatchListener;
import de.mirkosertic.pdfbatch.batch.BatchSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Locale;

/**
 * Shows a desktop notification when a batch completes.
 */
public class NotificationService implements BatchListener {

    private static final Logger logger = LoggerFactory.getLogger(NotificationService.class);

    private final String os;

    public NotificationService() {
        this.os = System.getProperty("os.name").toLowerCase(Locale.ROOT);
        logger.debug("NotificationService initialized for OS: {}", os);
    }

    @Override
    public void onBatchCompleted(final BatchSummary summary) {
        notify(titleFor(summary), messageFor(summary));
    }

    static String titleFor(final BatchSummary summary) {
        if (summary.stopRequested()) {
            return "PDF conversion stopped";
        }
        return summary.allConverted() ? "PDF conversion finished" : "PDF conversion finished with errors";
    }

    static String messageFor(final BatchSummary summary) {
        final StringBuilder message = new StringBuilder();
        message.append(summary.succeeded() + summary.renamed()).append(" of ").append(summary.total())
                .append(" file(s) converted");
        if (summary.renamed() > 0) {
            message.append(", ").append(summary.renamed()).append(" renamed");
        }
        if (summary.failed() > 0) {
            message.append(", ").append(summary.failed()).append(" failed");
        }
        if (summary.notProcessed() > 0) {
            message.append(", ").append(summary.notProcessed()).append(" not processed");
        }
        return message.toString();
    }

    public void notify(final String title, final String message) {
        try {
            if (os.contains("mac")) {
                notifyMacOS(title, message);
            } else if (os.contains("win")) {
                notifyWindows(title, message);
            } else if (os.contains("linux")) {
                notifyLinux(title, message);
            } else {
                logger.debug("Notifications not supported on this OS: {}", os);
            }
        } catch (final IOException e) {
            logger.debug("Failed to send notification: {}", e.getMessage());
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.debug("Interrupted while sending notification");
        }
    }

    private void notifyMacOS(final String title, final String message) throws IOException {
        final ProcessBuilder pb = new ProcessBuilder(
                "osascript", "-e",
                String.format("display notification \"%s\" with title \"%s\"",
                        escapeForAppleScript(message),
                        escapeForAppleScript(title))
        );
        pb.start();
        // Don't wait - notifications are asynchronous
    }

    private void notifyWindows(final String title, final String message) throws IOException, InterruptedException {
        final String script = String.format(
                "[Windows.UI.Notifications.ToastNotificationManager, Windows.UI.Notifications, ContentType = WindowsRuntime] | Out-Null; " +
                "$template = [Windows.UI.Notifications.ToastNotificationManager]::GetTemplateContent([Windows.UI.Notifications.ToastTemplateType]::ToastText02); " +
                "$textNodes = $template.GetElementsByTagName('text'); " +
                "$textNodes.Item(0).AppendChild($template.CreateTextNode('%s')) | Out-Null; " +
                "$textNodes.Item(1).AppendChild($template.CreateTextNode('%s')) | Out-Null; " +
                "$toast = [Windows.UI.Notifications.ToastNotification]::new($template); " +
                "[Windows.UI.Notifications.ToastNotificationManager]::CreateToastNotifier('PDF Batch Converter').Show($toast);",
                escapeForPowerShell(title),
                escapeForPowerShell(message)
        );
        final ProcessBuilder pb = new ProcessBuilder("powershell", "-Command", script);
        pb.redirectOutput(ProcessBuilder.Redirect.DISCARD);
        pb.redirectError(ProcessBuilder.Redirect.DISCARD);
        final Process p = pb.start();
        p.waitFor();
    }

    private void notifyLinux(final String title, final String message) throws IOException, InterruptedException {
        // notify-send is available on most Linux desktops
        final ProcessBuilder pb = new ProcessBuilder("notify-send", title, message);
        pb.redirectOutput(ProcessBuilder.Redirect.DISCARD);
        pb.redirectError(ProcessBuilder.Redirect.DISCARD);
        final Process p = pb.start();
        p.waitFor();
    }

    private String escapeForAppleScript(final String text) {
        return text.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    private String escapeForPowerShell(final String text) {
        return text.replace("'", "''").replace("\"", "`\"");
    }
}
