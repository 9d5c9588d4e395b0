package io.pricingworkers.error;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.pricingworkers.core.Json;
import io.pricingworkers.core.TaskEnvelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Appends one JSON line per failed envelope, including the full envelope so it can be replayed.
 */
public class FileDeadLetterSink implements DeadLetterSink {
    private static final Logger log = LoggerFactory.getLogger(FileDeadLetterSink.class);

    private final Path file;

    public FileDeadLetterSink(Path file) throws IOException {
        this.file = file;
        if (file.getParent() != null) Files.createDirectories(file.getParent());
        if (!Files.exists(file)) {
            Files.writeString(file, "", StandardCharsets.UTF_8, StandardOpenOption.CREATE);
        }
    }

    public Path file() { return file; }

    @Override
    public synchronized void acceptFailure(String stage, TaskEnvelope envelope, StageError error) {
        Map<String, Object> line = new LinkedHashMap<>();
        line.put("ts", Instant.now().toString());
        line.put("stage", stage);
        line.put("error", error);
        line.put("envelope", envelope);
        try {
            String json = Json.mapper().writeValueAsString(line) + System.lineSeparator();
            Files.writeString(file, json, StandardCharsets.UTF_8, StandardOpenOption.APPEND);
        } catch (JsonProcessingException e) {
            log.error("dead letter encode failed task={} id={}", stage, envelope.taskId(), e);
        } catch (IOException e) {
            log.error("dead letter write failed file={} id={}", file, envelope.taskId(), e);
        }
    }
}
