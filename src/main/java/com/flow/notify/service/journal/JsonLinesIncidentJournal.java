package com.flow.notify.service.journal;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flow.notify.service.config.MetricsConfig;
import com.flow.notify.service.escalation.IncidentEvent;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Journal that appends one JSON object per line to a file.
 *
 * Writes are serialized on a single writer thread so records keep their
 * append order; the caller only pays for the hand-off.
 */
@Slf4j
public class JsonLinesIncidentJournal implements IncidentJournal, AutoCloseable {

    private final ObjectMapper objectMapper;
    private final MetricsConfig metricsConfig;
    private final ExecutorService writerExecutor;
    private final Path path;
    private final BufferedWriter writer;

    public JsonLinesIncidentJournal(Path path, ObjectMapper objectMapper, MetricsConfig metricsConfig,
                                    ExecutorService writerExecutor) {
        this.path = path;
        this.objectMapper = objectMapper;
        this.metricsConfig = metricsConfig;
        this.writerExecutor = writerExecutor;
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            this.writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot open incident journal " + path, e);
        }
        log.info("Incident journal writing to {}", path.toAbsolutePath());
    }

    @Override
    public void append(String incidentId, IncidentEvent event) {
        try {
            writerExecutor.execute(() -> write(new JournalRecord(incidentId, event)));
        } catch (RejectedExecutionException e) {
            metricsConfig.getJournalWriteFailures().increment();
            log.warn("Incident journal closed, dropped {} for incident {}", event.type(), incidentId);
        }
    }

    private void write(JournalRecord record) {
        try {
            writer.write(objectMapper.writeValueAsString(record));
            writer.newLine();
            writer.flush();
        } catch (IOException e) {
            metricsConfig.getJournalWriteFailures().increment();
            log.error("Failed to write incident journal record for {}", record.incidentId(), e);
        }
    }

    public Path getPath() {
        return path;
    }

    @Override
    public void close() {
        writerExecutor.shutdown();
        try {
            if (!writerExecutor.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Incident journal writer did not drain within 10s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        try {
            writer.close();
        } catch (IOException e) {
            log.error("Failed to close incident journal {}", path, e);
        }
    }
}
