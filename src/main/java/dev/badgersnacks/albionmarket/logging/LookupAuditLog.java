package dev.badgersnacks.albionmarket.logging;

import dev.badgersnacks.albionmarket.services.ItemLookupService.LookupResult;
import dev.badgersnacks.albionmarket.services.ItemLookupService.ResolvedItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Per-session file recording every query and what it resolved to, for checking how well aliases work.
 */
public final class LookupAuditLog implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(LookupAuditLog.class);
    private static final DateTimeFormatter FILE_FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneId.systemDefault());
    private static final DateTimeFormatter ENTRY_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS").withZone(ZoneId.systemDefault());

    private final Path logFile;
    private final BufferedWriter writer;
    private final Clock clock;

    public static LookupAuditLog open(Path logsDir) throws IOException {
        return open(logsDir, Clock.systemDefaultZone());
    }

    public static LookupAuditLog open(Path logsDir, Clock clock) throws IOException {
        Objects.requireNonNull(logsDir, "logsDir");
        Objects.requireNonNull(clock, "clock");
        Files.createDirectories(logsDir);
        String fileName = "lookups-" + FILE_FORMAT.format(clock.instant()) + ".log";
        Path file = logsDir.resolve(fileName).toAbsolutePath();
        BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        return new LookupAuditLog(file, writer, clock);
    }

    private LookupAuditLog(Path logFile, BufferedWriter writer, Clock clock) {
        this.logFile = logFile;
        this.writer = writer;
        this.clock = clock;
    }

    public Path getLogFile() {
        return logFile;
    }

    public void record(LookupResult result) {
        ResolvedItem primary = result.primary();
        StringBuilder line = new StringBuilder()
                .append(result.query())
                .append(" | Matched -> ")
                .append(primary.displayName())
                .append(" (")
                .append(primary.uniqueId())
                .append(')');
        if (!result.suggestions().isEmpty()) {
            line.append(" | Suggestions:");
            for (ResolvedItem suggestion : result.suggestions()) {
                line.append(' ').append(suggestion.uniqueId());
            }
        }
        write(line.toString(), null);
    }

    public void recordFailure(String query, Throwable error) {
        write(query + " | Failed: " + error.getMessage(), error);
    }

    private synchronized void write(String message, Throwable error) {
        try {
            writer.write(ENTRY_FORMAT.format(clock.instant()));
            writer.write(' ');
            writer.write(message);
            writer.newLine();
            if (error != null) {
                StringWriter trace = new StringWriter();
                error.printStackTrace(new PrintWriter(trace));
                writer.write(trace.toString());
            }
            writer.flush();
        } catch (IOException e) {
            LOGGER.warn("Failed to write lookup audit entry to {}", logFile, e);
        }
    }

    @Override
    public synchronized void close() {
        try {
            writer.close();
        } catch (IOException e) {
            LOGGER.warn("Failed to close lookup audit log {}", logFile, e);
        }
    }
}
