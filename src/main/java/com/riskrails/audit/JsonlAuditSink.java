package com.riskrails.audit;

import com.riskrails.mapper.JsonHelper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Appends each audit record as one JSON line. Writes are serialized so lines never interleave.
 */
@Component
public class JsonlAuditSink implements AuditSink {

    private static final Logger log = LoggerFactory.getLogger(JsonlAuditSink.class);

    private final Path path;

    public JsonlAuditSink(@Value("${riskrails.audit.path:logs/executions.jsonl}") String path) {
        this.path = Path.of(path);
    }

    @Override
    public synchronized void append(AuditRecord auditRecord) {
        try {
            String line = JsonHelper.toJson(auditRecord) + System.lineSeparator();
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(
                    path, line, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException | RuntimeException e) {
            log.error("Failed to append audit record: path={}, key={}", path, auditRecord.getIdempotencyKey(), e);
        }
    }

    public Path getPath() {
        return path;
    }
}
