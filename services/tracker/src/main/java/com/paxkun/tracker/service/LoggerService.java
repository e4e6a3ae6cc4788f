package com.paxkun.tracker.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.file.*;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.stream.Stream;

/**
 * Tagged application log. Every line goes to SLF4J and, when a writable log directory is
 * available, to {@code latest.log}, which is rotated on startup keeping the newest archives.
 * <p>
 * Author: Pax
 */
@Slf4j
@Service
public class LoggerService implements InitializingBean, DisposableBean {

    static final String LATEST_LOG = "latest.log";
    static final int MAX_LOGS = 5;
    private static final DateTimeFormatter FILE_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd_HH-mm-ss");
    private static final DateTimeFormatter LOG_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    @Value("${tracker.logs.dir:./logs}")
    private String logsDir;

    private Path logsPath;
    private BufferedWriter writer;

    @Override
    public void afterPropertiesSet() {
        Path candidate = resolveLogsPath();
        if (candidate == null) {
            log.warn("⚠️ No log directory configured. LoggerService will operate in console-only mode.");
            return;
        }

        try {
            logsPath = createDirectories(candidate);
            log.info("📂 Using logs directory at {}", logsPath.toAbsolutePath());
        } catch (IOException e) {
            log.warn("⚠️ Failed to create logs directory at {}. LoggerService will operate in console-only mode.",
                    candidate.toAbsolutePath(), e);
            logsPath = null;
            return;
        }

        try {
            rotateLogs();
        } catch (IOException e) {
            log.warn("⚠️ Failed to rotate logs at {}. Continuing without rotating existing logs.",
                    logsPath.toAbsolutePath(), e);
        }

        Path latestLogPath = logsPath.resolve(LATEST_LOG);
        try {
            writer = Files.newBufferedWriter(latestLogPath, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            logSystemEnvironment();
            log.info("📝 LoggerService initialized. Logging to {}", latestLogPath.toAbsolutePath());
        } catch (IOException e) {
            log.warn("⚠️ Failed to initialize log writer at {}. LoggerService will operate in console-only mode.",
                    latestLogPath.toAbsolutePath(), e);
            writer = null;
        }
    }

    @Override
    public synchronized void destroy() {
        if (writer == null) {
            return;
        }
        try {
            writer.close();
        } catch (IOException e) {
            log.warn("⚠️ Failed to close log file", e);
        }
        writer = null;
    }

    protected Path resolveLogsPath() {
        if (logsDir == null || logsDir.isBlank()) {
            return null;
        }
        return Path.of(logsDir);
    }

    protected Path createDirectories(Path path) throws IOException {
        return Files.createDirectories(path);
    }

    private void rotateLogs() throws IOException {
        Path latestLog = logsPath.resolve(LATEST_LOG);
        if (Files.exists(latestLog) && Files.size(latestLog) > 0) {
            String timestamp = LocalDateTime.now().format(FILE_FORMATTER);
            Path archivedLog = logsPath.resolve(timestamp + ".log");
            Files.move(latestLog, archivedLog, StandardCopyOption.REPLACE_EXISTING);
            log.info("🔄 Rotated log to {}", archivedLog.getFileName());
        }

        try (Stream<Path> files = Files.list(logsPath)
                .filter(p -> p.getFileName().toString().endsWith(".log"))
                .filter(p -> !p.getFileName().toString().equals(LATEST_LOG))
                .sorted(Comparator.comparingLong(this::getFileModifiedTime).reversed())) {

            files.skip(MAX_LOGS)
                    .forEach(p -> {
                        try {
                            Files.delete(p);
                            log.info("🗑️ Deleted old log file: {}", p.getFileName());
                        } catch (IOException e) {
                            log.warn("⚠️ Failed to delete old log file: {}", p.getFileName(), e);
                        }
                    });
        }
    }

    private long getFileModifiedTime(Path path) {
        try {
            return Files.getLastModifiedTime(path).toMillis();
        } catch (IOException e) {
            return 0L;
        }
    }

    private synchronized void write(String level, String tag, String message) {
        if (writer == null) {
            return;
        }
        String logLine = String.format("%s [%s] [%s] %s%n", LocalDateTime.now().format(LOG_FORMATTER), level, tag, message);
        try {
            writer.write(logLine);
            writer.flush();
        } catch (IOException e) {
            log.error("❌ Failed to write to log file", e);
            writer = null;
        }
    }

    public void info(String tag, String message) {
        log.info("[{}] {}", tag, message);
        write("INFO", tag, message);
    }

    public void warn(String tag, String message) {
        log.warn("[{}] {}", tag, message);
        write("WARN", tag, message);
    }

    public void error(String tag, String message) {
        log.error("[{}] {}", tag, message);
        write("ERROR", tag, message);
    }

    public void error(String tag, String message, Throwable throwable) {
        log.error("[{}] {}", tag, message, throwable);
        write("ERROR", tag, message + " | Exception: " + throwable.getMessage());
    }

    public void debug(String tag, String message) {
        log.debug("[{}] {}", tag, message);
        write("DEBUG", tag, message);
    }

    public Path getLogsPath() {
        return logsPath;
    }

    /**
     * Strips line breaks from text that came from outside (scraped pages, request parameters).
     */
    public static String sanitizeForLog(String value) {
        if (value == null) {
            return "null";
        }
        return value.replace('\r', ' ').replace('\n', ' ');
    }

    private void logSystemEnvironment() {
        write("SYSTEM", "USER", System.getProperty("user.name"));
        write("SYSTEM", "OS", System.getProperty("os.name") + " " + System.getProperty("os.version"));
        write("SYSTEM", "JAVA", System.getProperty("java.version"));
    }
}
