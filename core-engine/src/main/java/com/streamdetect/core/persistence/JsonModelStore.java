package com.streamdetect.core.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Stores {@link DetectorSnapshot}s as {@code <id>.json} files in one
 * directory.
 *
 * <p>
 * Writes go to a temporary file that is then moved over the target, so a
 * reader never sees a half-written snapshot. Ids that could escape the
 * directory (path separators, {@code ..}) are rejected.
 * </p>
 *
 * @since 1.0.0
 */
public class JsonModelStore {

    private static final Logger LOG = LoggerFactory.getLogger(JsonModelStore.class);

    static final String EXTENSION = ".json";

    private final Path directory;
    private final ObjectMapper mapper;

    public JsonModelStore(Path directory) {
        this.directory = Objects.requireNonNull(directory, "Store directory must not be null");
        this.mapper = SnapshotCodec.mapper();
    }

    /**
     * Persist a snapshot, replacing any earlier one with the same id.
     *
     * @throws IllegalArgumentException if the id is not a safe file name
     * @throws IllegalStateException    if writing fails
     */
    public void save(DetectorSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "Snapshot must not be null");
        Path target = pathFor(snapshot.getId());
        try {
            Files.createDirectories(directory);
            Path temp = Files.createTempFile(directory, snapshot.getId() + ".", ".tmp");
            try {
                mapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), snapshot);
                move(temp, target);
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to save detector '" + snapshot.getId()
                    + "' to " + target, e);
        }
        LOG.info("Saved detector '{}' (model version {}) to {}",
                snapshot.getId(), snapshot.getModelVersion(), target);
    }

    /**
     * @return the snapshot, or empty if none is stored under {@code id}
     * @throws IllegalStateException if the file exists but cannot be read
     */
    public Optional<DetectorSnapshot> load(String id) {
        Path source = pathFor(id);
        if (!Files.exists(source)) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(source.toFile(), DetectorSnapshot.class));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load detector '" + id + "' from " + source, e);
        }
    }

    /**
     * @return {@code true} if a snapshot was deleted
     */
    public boolean delete(String id) {
        Path target = pathFor(id);
        try {
            boolean deleted = Files.deleteIfExists(target);
            if (deleted) {
                LOG.info("Deleted stored detector '{}'", id);
            }
            return deleted;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to delete " + target, e);
        }
    }

    /**
     * @return ids of all stored snapshots, sorted
     */
    public List<String> list() {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        List<String> ids = new ArrayList<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + EXTENSION)) {
            for (Path file : files) {
                String name = file.getFileName().toString();
                ids.add(name.substring(0, name.length() - EXTENSION.length()));
            }
        } catch (NoSuchFileException e) {
            return List.of();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to list " + directory, e);
        }
        Collections.sort(ids);
        return ids;
    }

    public Path getDirectory() {
        return directory;
    }

    /**
     * @throws IllegalArgumentException if {@code id} is blank or could escape
     *                                  the store directory
     */
    static void validateId(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Detector id must not be blank");
        }
        if (id.contains("/") || id.contains("\\") || id.contains("..") || id.indexOf('\0') >= 0) {
            throw new IllegalArgumentException("Detector id is not a safe file name: '" + id + "'");
        }
    }

    private Path pathFor(String id) {
        validateId(id);
        return directory.resolve(id + EXTENSION);
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
