package io.engram.core.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One pretty-printed JSON file per user under a directory, replaced atomically on every save.
 */
public final class FileMemorySpaceStore implements MemorySpaceStore {
    private static final Logger LOG = LoggerFactory.getLogger(FileMemorySpaceStore.class);
    private static final String SUFFIX = ".json";

    private final Path directory;
    private final ObjectMapper mapper;

    public FileMemorySpaceStore(Path directory) {
        this.directory = directory;
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public synchronized Optional<MemorySpaceSnapshot> load(String userId) throws IOException {
        Path path = pathFor(userId);
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        return Optional.of(mapper.readValue(Files.readString(path, StandardCharsets.UTF_8), MemorySpaceSnapshot.class));
    }

    @Override
    public synchronized void save(MemorySpaceSnapshot snapshot) throws IOException {
        Files.createDirectories(directory);
        Path path = pathFor(snapshot.userId());
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(snapshot);
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        Files.writeString(tmp, json + System.lineSeparator(), StandardCharsets.UTF_8);
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        LOG.debug("Saved memory space {} ({} units)", snapshot.userId(), snapshot.units().size());
    }

    @Override
    public synchronized List<String> userIds() throws IOException {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        List<String> ids = new ArrayList<>();
        try (Stream<Path> files = Files.list(directory)) {
            files.map(path -> path.getFileName().toString())
                .filter(name -> name.endsWith(SUFFIX))
                .sorted()
                .forEach(name -> ids.add(name.substring(0, name.length() - SUFFIX.length())));
        }
        return ids;
    }

    private Path pathFor(String userId) {
        if (userId == null || !userId.matches("[A-Za-z0-9._-]{1,64}") || userId.startsWith(".")) {
            throw new IllegalArgumentException("user id must be 1-64 characters of letters, digits, '.', '_' or '-': " + userId);
        }
        return directory.resolve(userId + SUFFIX);
    }
}
