package com.paxkun.pulldb.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Tagged audit log for PullDB. Every line goes to the console and, when a writable log
 * directory can be found, to {@code latest.log}, which is rotated on startup (last 5 kept).
 *
 * Author: Pax
 */
@Slf4j
@Service
public class LoggerService implements InitializingBean, DisposableBean {

    private static final String LATEST_LOG = "latest.log";
    private static final int MAX_LOGS = 5;
    private static final DateTimeFormatter FILE_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd_HH-mm-ss");
    private static final DateTimeFormatter LOG_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final Path CONTAINER_FALLBACK = Path.of("/app", "logs");

    @Value("${pulldb.logs.dir:}")
    private String configuredLogsDir;

    private Path logsPath;
    private BufferedWriter writer;

    @Override
    public void afterPropertiesSet() {
        logsPath = resolveLogsDirectory();
        if (logsPath == null) {
            log.warn("⚠️ LoggerService has no writable log directory. Console output only.");
            return;
        }

        try {
            rotateLogs();
        } catch (IOException e) {
            log.warn("⚠️ Failed to rotate logs at {}. Continuing with the existing files.", logsPath.toAbsolutePath(), e);
        }

        Path latestLogPath = logsPath.resolve(LATEST_LOG);
        try {
            writer = Files.newBufferedWriter(latestLogPath, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            write("SYSTEM", "LOGS_DIR", logsPath.toAbsolutePath().toString());
            log.info("📝 LoggerService initialized. Logging to {}", latestLogPath.toAbsolutePath());
        } catch (IOException e) {
            log.warn("⚠️ Failed to open {}. LoggerService will operate in console-only mode.", latestLogPath.toAbsolutePath(), e);
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
            log.warn("⚠️ Failed to close log writer", e);
        } finally {
            writer = null;
        }
    }

    private Path resolveLogsDirectory() {
        List<Path> candidates = new ArrayList<>();
        Path configured = resolveConfiguredPath();
        if (configured != null) {
            candidates.add(configured);
        }
        candidates.add(resolveUserHomePath());
        candidates.add(resolveContainerFallbackPath());

        for (Path candidate : candidates) {
            try {
                Path created = createDirectories(candidate);
                log.info("📁 Using log directory {}", created.toAbsolutePath());
                return created;
            } catch (IOException e) {
                log.warn("⚠️ Failed to create log directory at {}. Trying the next location.", candidate.toAbsolutePath(), e);
            }
        }
        return null;
    }

    protected Path createDirectories(Path path) throws IOException {
        return Files.createDirectories(path);
    }

    protected Path resolveConfiguredPath() {
        if (configuredLogsDir != null && !configuredLogsDir.isBlank()) {
            return Path.of(configuredLogsDir);
        }
        return null;
    }

    protected Path resolveUserHomePath() {
        String userHome = System.getProperty("user.home");
        if (userHome != null && !userHome.isBlank()) {
            return Path.of(userHome, ".noona", "pulldb", "logs");
        }
        return Path.of(".noona", "pulldb", "logs");
    }

    protected Path resolveContainerFallbackPath() {
        return CONTAINER_FALLBACK;
    }

    private void rotateLogs() throws IOException {
        Path latestLog = logsPath.resolve(LATEST_LOG);
        if (Files.exists(latestLog) && Files.size(latestLog) > 0) {
            Path archivedLog = logsPath.resolve(LocalDateTime.now().format(FILE_FORMATTER) + ".log");
            Files.move(latestLog, archivedLog, StandardCopyOption.REPLACE_EXISTING);
            log.info("🔄 Rotated log to {}", archivedLog.getFileName());
        }

        List<Path> archives;
        try (Stream<Path> files = Files.list(logsPath)) {
            archives = files
                    .filter(p -> p.getFileName().toString().endsWith(".log"))
                    .filter(p -> !p.getFileName().toString().equals(LATEST_LOG))
                    .sorted(Comparator.comparing((Path p) -> p.getFileName().toString()).reversed())
                    .toList();
        }
        for (Path stale : archives.stream().skip(MAX_LOGS - 1).toList()) {
            try {
                Files.delete(stale);
                log.info("🗑️ Deleted old log file: {}", stale.getFileName());
            } catch (IOException e) {
                log.warn("⚠️ Failed to delete old log file: {}", stale.getFileName(), e);
            }
        }
    }

    private synchronized void write(String level, String tag, String message) {
        String logLine = String.format("%s [%s] [%s] %s%n", LocalDateTime.now().format(LOG_FORMATTER), level, tag, message);
        if (writer != null) {
            try {
                writer.write(logLine);
                writer.flush();
            } catch (IOException e) {
                log.error("❌ Failed to write to log file", e);
                writer = null;
            }
        }
        System.out.print(logLine);
    }

    public void info(String tag, String message) {
        write("INFO", tag, message);
    }

    public void warn(String tag, String message) {
        write("WARN", tag, message);
    }

    public void error(String tag, String message, Throwable throwable) {
        write("ERROR", tag, message + " | Exception: " + throwable.getMessage());
    }

    public void debug(String tag, String message) {
        write("DEBUG", tag, message);
    }

    public Path getLogsPath() {
        return logsPath;
    }
}
