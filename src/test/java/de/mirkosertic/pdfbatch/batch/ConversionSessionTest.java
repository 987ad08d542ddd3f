package de.mirkosertic.pdfbatch.batch;

import de.mirkosertic.pdfbatch.engine.ConversionEngine;
import de.mirkosertic.pdfbatch.engine.ConversionException;
import de.mirkosertic.pdfbatch.engine.DocumentHandle;
import de.mirkosertic.pdfbatch.engine.EngineHandle;
import de.mirkosertic.pdfbatch.engine.FailureReason;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("ConversionSession Tests")
class ConversionSessionTest {

    private static final Path SOURCE = Path.of("in", "letter.docx");
    private static final Path TARGET = Path.of("out", "letter.pdf");

    private ConversionEngine engine;
    private EngineHandle handle;
    private DocumentHandle document;

    @BeforeEach
    void setUp() throws ConversionException {
        engine = mock(ConversionEngine.class);
        handle = mock(EngineHandle.class);
        document = mock(DocumentHandle.class);
        when(engine.engineName()).thenReturn("Mock");
        when(engine.startEngine()).thenReturn(handle);
        when(handle.openDocument(any(Path.class))).thenReturn(document);
    }

    @Test
    @DisplayName("Should start the engine lazily and reuse it for following documents")
    void shouldStartLazilyAndReuse() throws Exception {
        try (ConversionSession session = new ConversionSession(engine, Duration.ofSeconds(5), "worker-1")) {
            // Given: nothing started yet
            assertThat(session.isStarted()).isFalse();
            verify(engine, never()).startEngine();

            // When
            session.convert(SOURCE, TARGET);
            session.convert(SOURCE, TARGET);

            // Then
            assertThat(session.isStarted()).isTrue();
            assertThat(session.getEnginesStarted()).isEqualTo(1);
            verify(engine, times(1)).startEngine();
            verify(document, times(2)).exportAs(TARGET);
            verify(document, times(2)).close();
        }
        verify(handle, times(1)).stopEngine();
    }

    @Test
    @DisplayName("Should stop the engine exactly once even when closed repeatedly")
    void shouldStopEngineOnce() throws Exception {
        final ConversionSession session = new ConversionSession(engine, Duration.ofSeconds(5), "worker-1");
        session.ensureStarted();

        session.close();
        session.close();

        verify(handle, times(1)).stopEngine();
        assertThatThrownBy(session::ensureStarted).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Should not touch the engine when closed before first use")
    void shouldNotStartEngineOnCloseOnly() throws Exception {
        final ConversionSession session = new ConversionSession(engine, Duration.ofSeconds(5), "worker-1");

        session.close();

        verify(engine, never()).startEngine();
    }

    @Test
    @DisplayName("Should report a failing start as engine unavailable")
    void shouldReportStartFailureAsUnavailable() throws Exception {
        when(engine.startEngine()).thenThrow(new ConversionException(FailureReason.ENGINE_ERROR, "boom"));
        final ConversionSession session = new ConversionSession(engine, Duration.ofSeconds(5), "worker-1");

        assertThatThrownBy(session::ensureStarted)
                .isInstanceOfSatisfying(ConversionException.class, e ->
                        assertThat(e.getReason()).isEqualTo(FailureReason.ENGINE_UNAVAILABLE))
                .hasMessageContaining("boom");
        assertThat(session.isStarted()).isFalse();
        session.close();
    }

    @Test
    @DisplayName("Should report unexpected engine exceptions as engine errors with the failed input")
    void shouldWrapRuntimeExceptions() throws Exception {
        doThrow(new IllegalStateException("native crash")).when(document).exportAs(TARGET);

        try (ConversionSession session = new ConversionSession(engine, Duration.ofSeconds(5), "worker-1")) {
            assertThatThrownBy(() -> session.convert(SOURCE, TARGET))
                    .isInstanceOfSatisfying(ConversionException.class, e -> {
                        assertThat(e.getReason()).isEqualTo(FailureReason.ENGINE_ERROR);
                        assertThat(e.getFailedInput()).isEqualTo(SOURCE.toString());
                    });
            // The engine is still usable after an item-level error
            assertThat(session.isStarted()).isTrue();
        }
        verify(document).close();
    }

    @Test
    @DisplayName("Should keep the engine after a source-level failure")
    void shouldKeepEngineAfterSourceFailure() throws Exception {
        when(handle.openDocument(SOURCE)).thenThrow(new ConversionException(FailureReason.SOURCE_LOCKED, "locked"));

        try (ConversionSession session = new ConversionSession(engine, Duration.ofSeconds(5), "worker-1")) {
            assertThatThrownBy(() -> session.convert(SOURCE, TARGET))
                    .isInstanceOfSatisfying(ConversionException.class, e ->
                            assertThat(e.getReason()).isEqualTo(FailureReason.SOURCE_LOCKED));
            assertThat(session.isStarted()).isTrue();
            verify(handle, never()).stopEngine();
        }
    }

    @Test
    @DisplayName("Should time out a hanging engine, discard it and start a fresh one")
    void shouldDiscardEngineAfterTimeout() throws Exception {
        // Given: the first export hangs until interrupted
        final CountDownLatch hang = new CountDownLatch(1);
        final EngineHandle secondHandle = mock(EngineHandle.class);
        final DocumentHandle secondDocument = mock(DocumentHandle.class);
        when(engine.startEngine()).thenReturn(handle, secondHandle);
        when(secondHandle.openDocument(any(Path.class))).thenReturn(secondDocument);
        doAnswer(invocation -> {
            hang.await(10, TimeUnit.SECONDS);
            return null;
        }).when(document).exportAs(TARGET);

        try (ConversionSession session = new ConversionSession(engine, Duration.ofMillis(200), "worker-1")) {
            // When
            assertThatThrownBy(() -> session.convert(SOURCE, TARGET))
                    .isInstanceOfSatisfying(ConversionException.class, e ->
                            assertThat(e.getReason()).isEqualTo(FailureReason.ENGINE_TIMEOUT));

            // Then: the hung instance was stopped and the next document gets a new one
            verify(handle).stopEngine();
            assertThat(session.isStarted()).isFalse();
            session.convert(SOURCE, TARGET);
            assertThat(session.getEnginesStarted()).isEqualTo(2);
            verify(secondDocument).exportAs(TARGET);
        }
        verify(secondHandle).stopEngine();
    }

    @Test
    @DisplayName("Should stop an engine whose start completes after the timeout")
    void shouldStopEngineStartedAfterTimeout() throws Exception {
        // Given: a start that ignores interruption and finishes only when released
        final CountDownLatch release = new CountDownLatch(1);
        when(engine.startEngine()).thenAnswer(invocation -> {
            while (release.getCount() > 0) {
                try {
                    release.await();
                } catch (final InterruptedException e) {
                    // keep starting, like a native process that cannot be cancelled
                }
            }
            return handle;
        });
        final ConversionSession session = new ConversionSession(engine, Duration.ofMillis(200), "worker-1");

        // When
        assertThatThrownBy(session::ensureStarted)
                .isInstanceOfSatisfying(ConversionException.class, e ->
                        assertThat(e.getReason()).isEqualTo(FailureReason.ENGINE_UNAVAILABLE));
        release.countDown();

        // Then: the late instance is stopped although nobody holds it
        verify(handle, timeout(5000)).stopEngine();
        assertThat(session.isStarted()).isFalse();
        session.close();
        verify(handle, times(1)).stopEngine();
    }

    @Test
    @DisplayName("Should run every engine call on the same dedicated thread")
    void shouldUseSingleCallThread() throws Exception {
        final String[] threads = new String[3];
        when(engine.startEngine()).thenAnswer(invocation -> {
            threads[0] = Thread.currentThread().getName();
            return handle;
        });
        doAnswer(invocation -> {
            threads[1] = Thread.currentThread().getName();
            return null;
        }).when(document).exportAs(TARGET);
        doAnswer(invocation -> {
            threads[2] = Thread.currentThread().getName();
            return null;
        }).when(handle).stopEngine();

        final ConversionSession session = new ConversionSession(engine, Duration.ofSeconds(5), "worker-7");
        session.convert(SOURCE, TARGET);
        session.close();

        assertThat(threads[0]).isEqualTo("worker-7-engine-1");
        assertThat(threads).containsOnly(threads[0]);
        assertThat(threads[0]).isNotEqualTo(Thread.currentThread().getName());
    }

    @Test
    @DisplayName("Should reject a non-positive timeout")
    void shouldRejectInvalidTimeout() {
        assertThatThrownBy(() -> new ConversionSession(engine, Duration.ZERO, "worker-1"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
