package de.mirkosertic.pdfbatch.engine;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Converts documents with a headless LibreOffice ({@code soffice}).
 * <p>
 * Each engine instance gets its own user profile directory. LibreOffice refuses to run two
 * processes against the same profile, so isolated profiles are what allows several workers
 * to convert at the same time.
 */
public class LibreOfficeEngine implements ConversionEngine {

    private static final Logger logger = LoggerFactory.getLogger(LibreOfficeEngine.class);

    private final @Nullable Path configuredExecutable;
    private final String targetFormat;

    /**
     * @param configuredExecutable explicit path to {@code soffice}, or {@code null} to auto-detect
     * @param targetFormat         LibreOffice filter name passed to {@code --convert-to}, e.g. {@code pdf}
     */
    public LibreOfficeEngine(final @Nullable Path configuredExecutable, final String targetFormat) {
        this.configuredExecutable = configuredExecutable;
        this.targetFormat = targetFormat;
    }

    @Override
    public String engineName() {
        return "LibreOffice";
    }

    @Override
    public EngineHandle startEngine() throws ConversionException {
        final Path soffice = findSofficeExecutable().orElseThrow(() -> new ConversionException(
                FailureReason.ENGINE_UNAVAILABLE,
                "LibreOffice executable not found (configure engine.soffice-path or add soffice to PATH)"));
        try {
            final Path profileDir = Files.createTempDirectory("pdfbatch-lo-profile-");
            logger.debug("Started LibreOffice engine instance with profile {}", profileDir);
            return new LibreOfficeHandle(soffice, profileDir);
        } catch (final IOException e) {
            throw new ConversionException(FailureReason.ENGINE_UNAVAILABLE,
                    "Could not create LibreOffice profile directory: " + e.getMessage(), e);
        }
    }

    Optional<Path> findSofficeExecutable() {
        if (configuredExecutable != null) {
            return Files.isExecutable(configuredExecutable) ? Optional.of(configuredExecutable) : Optional.empty();
        }
        final String pathEnv = System.getenv("PATH");
        if (pathEnv != null) {
            for (final String part : pathEnv.split(System.getProperty("path.separator"))) {
                if (part.isBlank()) {
                    continue;
                }
                final Path candidate = Paths.get(part, isWindows() ? "soffice.exe" : "soffice");
                if (Files.isExecutable(candidate)) {
                    return Optional.of(candidate);
                }
            }
        }
        final List<Path> candidates = new ArrayList<>();
        if (isWindows()) {
            final String programFiles = System.getenv("ProgramFiles");
            final String programFilesX86 = System.getenv("ProgramFiles(x86)");
            if (programFiles != null) {
                candidates.add(Path.of(programFiles, "LibreOffice", "program", "soffice.exe"));
            }
            if (programFilesX86 != null) {
                candidates.add(Path.of(programFilesX86, "LibreOffice", "program", "soffice.exe"));
            }
        } else {
            candidates.add(Path.of("/Applications/LibreOffice.app/Contents/MacOS/soffice"));
            candidates.add(Path.of("/usr/lib/libreoffice/program/soffice"));
            candidates.add(Path.of("/opt/libreoffice/program/soffice"));
        }
        return candidates.stream().filter(Files::isExecutable).findFirst();
    }

    /**
     * Throws {@link FailureReason#SOURCE_LOCKED} if an office application holds the document open.
     */
    static void checkNotLocked(final Path source) throws ConversionException {
        final Path dir = source.toAbsolutePath().getParent();
        final String name = source.getFileName().toString();
        if (dir != null) {
            final Path libreOfficeLock = dir.resolve(".~lock." + name + "#");
            final Path wordOwnerFile = dir.resolve("~$" + (name.length() > 2 ? name.substring(2) : name));
            if (Files.exists(libreOfficeLock) || Files.exists(wordOwnerFile)) {
                throw new ConversionException(FailureReason.SOURCE_LOCKED,
                        "Document is open in another application: " + name, source.toString(), null);
            }
        }
        try (FileChannel ignored = FileChannel.open(source, StandardOpenOption.READ)) {
            logger.trace("Source {} is readable", source);
        } catch (final IOException e) {
            throw new ConversionException(FailureReason.SOURCE_LOCKED,
                    "Document cannot be opened for reading: " + e.getMessage(), source.toString(), e);
        }
    }

    private static boolean isWindows() {
        return System.getProperty("os.name").toLowerCase(Locale.ROOT).contains("win");
    }

    private static void deleteRecursively(final Path dir) {
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(dir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (final IOException e) {
                    logger.debug("Could not delete {}: {}", path, e.getMessage());
                }
            });
        } catch (final IOException e) {
            logger.warn("Could not clean up directory {}", dir, e);
        }
    }

    private final class LibreOfficeHandle implements EngineHandle {

        private final Path soffice;
        private final Path profileDir;
        private volatile @Nullable Process running;

        private LibreOfficeHandle(final Path soffice, final Path profileDir) {
            this.soffice = soffice;
            this.profileDir = profileDir;
        }

        @Override
        public DocumentHandle openDocument(final Path source) throws ConversionException {
            if (!Files.isRegularFile(source)) {
                throw new ConversionException(FailureReason.SOURCE_UNAVAILABLE,
                        "Source file does not exist: " + source, source.toString(), null);
            }
            checkNotLocked(source);
            try {
                final Path workDir = Files.createTempDirectory(profileDir.getParent(), "pdfbatch-lo-out-");
                return new LibreOfficeDocument(this, source, workDir);
            } catch (final IOException e) {
                throw new ConversionException(FailureReason.ENGINE_ERROR,
                        "Could not create working directory: " + e.getMessage(), source.toString(), e);
            }
        }

        @Override
        public void stopEngine() {
            final Process process = running;
            if (process != null && process.isAlive()) {
                logger.warn("Killing LibreOffice process {}", process.pid());
                process.destroyForcibly();
            }
            deleteRecursively(profileDir);
            logger.debug("Stopped LibreOffice engine instance with profile {}", profileDir);
        }

        private void convert(final Path source, final Path workDir) throws ConversionException {
            final List<String> command = new ArrayList<>();
            command.add(soffice.toString());
            command.add("-env:UserInstallation=" + profileDir.toUri());
            command.add("--headless");
            command.add("--norestore");
            command.add("--nologo");
            command.add("--convert-to");
            command.add(targetFormat);
            command.add("--outdir");
            command.add(workDir.toString());
            command.add(source.toAbsolutePath().toString());

            final Path processLog = workDir.resolve("soffice.log");
            final ProcessBuilder builder = new ProcessBuilder(command);
            builder.redirectErrorStream(true);
            builder.redirectOutput(processLog.toFile());

            Process process = null;
            try {
                process = builder.start();
                running = process;
                final int code = process.waitFor();
                if (code != 0) {
                    throw new ConversionException(FailureReason.ENGINE_ERROR,
                            "LibreOffice exited with code " + code + ": " + readLog(processLog),
                            source.toString(), null);
                }
            } catch (final IOException e) {
                throw new ConversionException(FailureReason.ENGINE_ERROR,
                        "LibreOffice could not be executed: " + e.getMessage(), source.toString(), e);
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ConversionException(FailureReason.ENGINE_ERROR,
                        "LibreOffice conversion was interrupted", source.toString(), e);
            } finally {
                running = null;
                if (process != null && process.isAlive()) {
                    process.destroyForcibly();
                }
            }
        }

        private String readLog(final Path processLog) {
            try {
                return Files.readString(processLog, StandardCharsets.UTF_8).trim();
            } catch (final IOException e) {
                return "(no output)";
            }
        }
    }

    private final class LibreOfficeDocument implements DocumentHandle {

        private final LibreOfficeHandle engine;
        private final Path source;
        private final Path workDir;

        private LibreOfficeDocument(final LibreOfficeHandle engine, final Path source, final Path workDir) {
            this.engine = engine;
            this.source = source;
            this.workDir = workDir;
        }

        @Override
        public void exportAs(final Path target) throws ConversionException {
            engine.convert(source, workDir);

            final String fileName = source.getFileName().toString();
            final int dot = fileName.lastIndexOf('.');
            final String producedName = (dot > 0 ? fileName.substring(0, dot) : fileName) + "." + targetFormat;
            final Path produced = workDir.resolve(producedName);
            if (!Files.exists(produced)) {
                throw new ConversionException(FailureReason.ENGINE_ERROR,
                        "LibreOffice did not produce an output file: " + producedName, source.toString(), null);
            }
            // An atomic rename may silently replace an existing file on POSIX systems
            if (Files.exists(target)) {
                throw new ConversionException(FailureReason.ENGINE_ERROR,
                        "Target file already exists: " + target, source.toString(), null);
            }
            try {
                try {
                    Files.move(produced, target, StandardCopyOption.ATOMIC_MOVE);
                } catch (final AtomicMoveNotSupportedException e) {
                    Files.move(produced, target);
                }
            } catch (final IOException e) {
                throw new ConversionException(FailureReason.ENGINE_ERROR,
                        "Could not move output to " + target + ": " + e.getMessage(), source.toString(), e);
            }
        }

        @Override
        public void close() {
            deleteRecursively(workDir);
        }
    }
}
