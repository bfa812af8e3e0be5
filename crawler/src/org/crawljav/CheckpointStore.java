package org.crawljav;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

/**
 * Stage checkpoints kept in a single JSON document. The whole document is rewritten through a
 * temporary file and renamed over the old one on every change, so a crash never leaves it half
 * written.
 */
public class CheckpointStore {
    private static final Logger log = LoggerFactory.getLogger(CheckpointStore.class);
    private static final TypeReference<TreeMap<String, Checkpoint>> DOCUMENT_TYPE = new TypeReference<>() {
    };
    private final Path file;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final TreeMap<String, Checkpoint> checkpoints;

    public CheckpointStore(Path file) throws IOException {
        this(file, Clock.systemUTC());
    }

    public CheckpointStore(Path file, Clock clock) throws IOException {
        this.file = file;
        this.clock = clock;
        this.mapper = new ObjectMapper()
                .findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
        if (Files.exists(file)) {
            this.checkpoints = mapper.readValue(file.toFile(), DOCUMENT_TYPE);
        } else {
            this.checkpoints = new TreeMap<>();
        }
    }

    public synchronized Optional<Checkpoint> get(Stage stage) {
        return Optional.ofNullable(checkpoints.get(stage.key()));
    }

    /**
     * Reads the cursor of a stage converted to the given type.
     */
    public synchronized <T> Optional<T> cursor(Stage stage, Class<T> type) {
        Checkpoint checkpoint = checkpoints.get(stage.key());
        if (checkpoint == null || checkpoint.cursor() == null) return Optional.empty();
        try {
            return Optional.of(mapper.convertValue(checkpoint.cursor(), type));
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring unreadable {} checkpoint {}", stage.key(), checkpoint.cursor(), e);
            return Optional.empty();
        }
    }

    public synchronized void save(Stage stage, Object cursor) throws IOException {
        Map<String, Object> cursorMap = mapper.convertValue(cursor, new TypeReference<Map<String, Object>>() {
        });
        checkpoints.put(stage.key(), new Checkpoint(cursorMap, clock.instant()));
        write();
    }

    public synchronized void clear(Stage stage) throws IOException {
        if (checkpoints.remove(stage.key()) != null) {
            write();
        }
    }

    private void write() throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        Path tmp = parent.resolve(file.getFileName() + ".tmp");
        mapper.writeValue(tmp.toFile(), checkpoints);
        try {
            Files.move(tmp, file, REPLACE_EXISTING, ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, file, REPLACE_EXISTING);
        }
    }

    public Path file() {
        return file;
    }
}
