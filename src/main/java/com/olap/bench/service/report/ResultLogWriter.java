package com.olap.bench.service.report;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

import org.springframework.stereotype.Component;

import com.olap.bench.config.BenchProperties;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Persists the successful values of a run to
 * {@code <results-dir>/<queryname>-<unixtimestamp>.txt}, one value per line.
 *
 * File system problems are logged and never fail the run: {@link #open}
 * returns empty when the log cannot be created, and a write error stops
 * further writes to that log only.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ResultLogWriter {

    private final BenchProperties properties;

    /**
     * Opens a result log for one run.
     *
     * @param queryName query set name, used as file name prefix
     * @param timestamp unix seconds, used as file name suffix
     * @return the open log, or empty if logging is disabled or the file could not be created
     */
    public Optional<ResultLog> open(String queryName, long timestamp) {
        BenchProperties.Results results = properties.getResults();
        if (!results.isEnabled()) {
            return Optional.empty();
        }

        Path directory = Paths.get(results.getDirectory());
        Path file = directory.resolve(queryName + "-" + timestamp + ".txt");
        try {
            Files.createDirectories(directory);
            return Optional.of(new ResultLog(file, Files.newBufferedWriter(file, StandardCharsets.UTF_8)));
        } catch (IOException e) {
            log.error("Creating result log {} failed: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * An open result log. Not thread-safe; written by the thread draining a run.
     */
    public static final class ResultLog implements AutoCloseable {

        private final Path path;
        private final BufferedWriter writer;
        private long bytesWritten;
        private boolean failed;

        ResultLog(Path path, BufferedWriter writer) {
            this.path = path;
            this.writer = writer;
        }

        public Path path() {
            return path;
        }

        /** False once a write has failed; the file is then incomplete. */
        public boolean isHealthy() {
            return !failed;
        }

        public long bytesWritten() {
            return bytesWritten;
        }

        public void append(long value) {
            if (failed) {
                return;
            }
            String line = value + "\n";
            try {
                writer.write(line);
                bytesWritten += line.length();
            } catch (IOException e) {
                failed = true;
                log.error("Writing result log {} failed: {}", path, e.getMessage());
            }
        }

        @Override
        public void close() {
            try {
                writer.close();
            } catch (IOException e) {
                failed = true;
                log.error("Closing result log {} failed: {}", path, e.getMessage());
            }
            log.info("Wrote {} bytes to {}", bytesWritten, path);
        }
    }
}
