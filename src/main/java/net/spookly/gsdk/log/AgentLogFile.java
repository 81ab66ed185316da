package net.spookly.gsdk.log;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.Clock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Agent output log: one flushed line per message, in {@code GSDK_output_<epochSeconds>.txt}.
 */
public final class AgentLogFile implements Closeable {
    private static final Logger LOGGER = LoggerFactory.getLogger(AgentLogFile.class);
    private static final String FILE_PREFIX = "GSDK_output_";
    private static final String FILE_SUFFIX = ".txt";

    private final Object lock = new Object();
    private final Path path;
    private BufferedWriter writer;

    private AgentLogFile(Path path, BufferedWriter writer) {
        this.path = path;
        this.writer = writer;
    }

    /**
     * A sink that drops every message.
     */
    public static AgentLogFile disabled() {
        return new AgentLogFile(null, null);
    }

    public static AgentLogFile open(String logFolder) {
        return open(logFolder, Clock.systemUTC());
    }

    /**
     * Open a new log file in {@code logFolder}, creating it when needed. Falls back to the working directory when the
     * folder cannot be created.
     */
    public static AgentLogFile open(String logFolder, Clock clock) {
        String fileName = FILE_PREFIX + clock.instant().getEpochSecond() + FILE_SUFFIX;
        Path folder = resolveFolder(logFolder);
        Path path = folder == null ? Paths.get(fileName) : folder.resolve(fileName);
        try {
            BufferedWriter writer = Files.newBufferedWriter(
                    path,
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.APPEND
            );
            return new AgentLogFile(path, writer);
        } catch (IOException e) {
            LOGGER.warn("Failed to open agent log file {}: {}", path, e.getMessage());
            return disabled();
        }
    }

    private static Path resolveFolder(String logFolder) {
        if (logFolder == null || logFolder.isBlank()) {
            return null;
        }
        try {
            Path folder = Paths.get(logFolder.trim());
            Files.createDirectories(folder);
            return folder;
        } catch (IOException | RuntimeException e) {
            LOGGER.warn("Failed to create log folder {}, using working directory: {}", logFolder, e.getMessage());
            return null;
        }
    }

    /**
     * Append one line. Does nothing once closed or when the sink is disabled.
     */
    public void log(String message) {
        synchronized (lock) {
            if (writer == null) {
                return;
            }
            try {
                writer.write(message == null ? "null" : message);
                writer.newLine();
                writer.flush();
            } catch (IOException e) {
                LOGGER.warn("Failed to write agent log file {}: {}", path, e.getMessage());
            }
        }
    }

    /**
     * Location of the log file, or null when disabled.
     */
    public Path path() {
        return path;
    }

    public boolean isOpen() {
        synchronized (lock) {
            return writer != null;
        }
    }

    @Override
    public void close() {
        synchronized (lock) {
            if (writer == null) {
                return;
            }
            try {
                writer.close();
            } catch (IOException e) {
                LOGGER.warn("Failed to close agent log file {}: {}", path, e.getMessage());
            } finally {
                writer = null;
            }
        }
    }
}
