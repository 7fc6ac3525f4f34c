package io.riff.core.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

public final class FileSessionSnapshotStore implements SessionSnapshotStore {
    private static final String SUFFIX = ".json";

    private final Path directory;
    private final ObjectMapper mapper;

    public FileSessionSnapshotStore(Path directory) {
        this.directory = directory;
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public synchronized void save(SessionSnapshot snapshot) throws IOException {
        Files.createDirectories(directory);
        Path target = fileFor(snapshot.sessionId());
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(snapshot);
        Files.writeString(tmp, json + System.lineSeparator());
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    @Override
    public synchronized Optional<SessionSnapshot> load(String sessionId) throws IOException {
        Path file = fileFor(sessionId);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        return Optional.of(mapper.readValue(Files.readString(file), SessionSnapshot.class));
    }

    @Override
    public synchronized List<String> list() throws IOException {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files
                .map(path -> path.getFileName().toString())
                .filter(name -> name.endsWith(SUFFIX))
                .map(name -> name.substring(0, name.length() - SUFFIX.length()))
                .sorted()
                .toList();
        }
    }

    private Path fileFor(String sessionId) {
        if (sessionId == null || !sessionId.matches("[A-Za-z0-9_.-]+") || sessionId.startsWith(".")) {
            throw new IllegalArgumentException("Invalid session id: " + sessionId);
        }
        return directory.resolve(sessionId + SUFFIX);
    }
}
