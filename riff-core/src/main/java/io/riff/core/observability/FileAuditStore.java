package io.riff.core.observability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class FileAuditStore implements AuditStore {
    private static final Logger LOG = LoggerFactory.getLogger(FileAuditStore.class);

    private final Path path;
    private final ObjectMapper mapper;

    public FileAuditStore(Path path) {
        this.path = path;
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public synchronized List<AuditEvent> load() throws IOException {
        if (!Files.exists(path)) {
            return List.of();
        }
        try {
            return mapper.readValue(Files.readString(path), new TypeReference<List<AuditEvent>>() {
            });
        } catch (JsonProcessingException e) {
            LOG.warn("Audit trail {} is unreadable, starting a new one: {}", path, e.getOriginalMessage());
            return List.of();
        }
    }

    @Override
    public synchronized void save(List<AuditEvent> events) throws IOException {
        Files.createDirectories(path.toAbsolutePath().getParent());
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(events);
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        Files.writeString(tmp, json + System.lineSeparator());
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }
}
