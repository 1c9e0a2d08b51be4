package com.automaker.core.persistence;

import com.automaker.core.errors.StorageException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.CopyOption;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Crash-safe JSON files: writes go to a temp file that is moved over the target, with
 * rolling {@code .bakN} copies of the previous content. Reads fall back to a leftover temp
 * file or the newest readable backup when the main file is missing or corrupt.
 */
public class AtomicJsonFiles {

    private static final Logger log = LoggerFactory.getLogger(AtomicJsonFiles.class);

    public static final int DEFAULT_BACKUP_COUNT = 3;

    private final ObjectMapper objectMapper;
    private final int backupCount;

    public AtomicJsonFiles(ObjectMapper objectMapper, int backupCount) {
        this.objectMapper = objectMapper.copy()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.backupCount = backupCount;
    }

    public ObjectMapper objectMapper() {
        return objectMapper;
    }

    /**
     * Writes {@code value} to {@code path} atomically, rotating backups first when
     * {@code withBackups} is set.
     */
    public void write(Path path, Object value, boolean withBackups) {
        Path tempPath = path.resolveSibling(path.getFileName() + ".tmp." + System.currentTimeMillis());
        try {
            Files.createDirectories(path.getParent());
            if (withBackups && backupCount > 0) {
                rotateBackups(path);
            }
            objectMapper.writeValue(tempPath.toFile(), value);
            moveIntoPlace(tempPath, path);
            log.debug("Wrote {}", path);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tempPath);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw new StorageException("Failed to write " + path, e);
        }
    }

    private void moveIntoPlace(Path from, Path to) throws IOException {
        try {
            move(from, to, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, replacing in place", to);
            move(from, to, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    void move(Path from, Path to, CopyOption... options) throws IOException {
        Files.move(from, to, options);
    }

    /**
     * Shifts {@code .bak1..N-1} up by one, dropping the oldest, and copies the current file to {@code .bak1}.
     */
    void rotateBackups(Path path) throws IOException {
        if (!Files.exists(path)) {
            return;
        }
        Files.deleteIfExists(backupPath(path, backupCount));
        for (int i = backupCount - 1; i >= 1; i--) {
            Path from = backupPath(path, i);
            if (Files.exists(from)) {
                Files.move(from, backupPath(path, i + 1), StandardCopyOption.REPLACE_EXISTING);
            }
        }
        Files.copy(path, backupPath(path, 1), StandardCopyOption.REPLACE_EXISTING);
    }

    public <T> RecoveredJson<T> readWithRecovery(Path path, Class<T> type, T defaultValue) {
        return readWithRecovery(path, objectMapper.constructType(type), defaultValue);
    }

    /**
     * Reads {@code path}, recovering from temp files (newest first) and then backups
     * ({@code .bak1} first). A recovered value is written back to the main path.
     */
    public <T> RecoveredJson<T> readWithRecovery(Path path, JavaType type, T defaultValue) {
        String mainError;
        try {
            T data = objectMapper.readValue(path.toFile(), type);
            return new RecoveredJson<>(data, false, RecoveredJson.Source.MAIN, null);
        } catch (NoSuchFileException | java.io.FileNotFoundException e) {
            mainError = "File not found";
        } catch (IOException e) {
            mainError = e.getMessage();
            log.warn("Failed to read {}: {}", path, e.getMessage());
        }

        for (Path temp : tempFiles(path)) {
            T data = tryRead(temp, type);
            if (data != null) {
                promote(temp, path);
                logRecovery(path, RecoveredJson.Source.TEMP, temp);
                return new RecoveredJson<>(data, true, RecoveredJson.Source.TEMP, mainError);
            }
        }

        for (int i = 1; i <= backupCount; i++) {
            Path backup = backupPath(path, i);
            if (!Files.exists(backup)) {
                continue;
            }
            T data = tryRead(backup, type);
            if (data != null) {
                restore(backup, path);
                logRecovery(path, RecoveredJson.Source.BACKUP, backup);
                return new RecoveredJson<>(data, true, RecoveredJson.Source.BACKUP, mainError);
            }
        }

        return new RecoveredJson<>(defaultValue, false, RecoveredJson.Source.DEFAULT, mainError);
    }

    static Path backupPath(Path path, int index) {
        return path.resolveSibling(path.getFileName() + ".bak" + index);
    }

    private List<Path> tempFiles(Path path) {
        String prefix = path.getFileName() + ".tmp.";
        Path dir = path.getParent();
        if (dir == null || !Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> entries = Files.list(dir)) {
            List<Path> temps = new ArrayList<>(entries
                    .filter(p -> p.getFileName().toString().startsWith(prefix))
                    .toList());
            temps.sort(Comparator.comparingLong((Path p) -> tempStamp(p, prefix)).reversed());
            return temps;
        } catch (IOException e) {
            log.debug("Could not list temp files for {}: {}", path, e.getMessage());
            return List.of();
        }
    }

    private static long tempStamp(Path temp, String prefix) {
        try {
            return Long.parseLong(temp.getFileName().toString().substring(prefix.length()));
        } catch (NumberFormatException e) {
            return 0L;
        }
    }

    private <T> T tryRead(Path candidate, JavaType type) {
        try {
            return objectMapper.readValue(candidate.toFile(), type);
        } catch (IOException e) {
            log.debug("Recovery candidate {} unreadable: {}", candidate, e.getMessage());
            return null;
        }
    }

    private void restore(Path from, Path to) {
        try {
            Files.copy(from, to, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            log.warn("Recovered {} but could not restore it to {}: {}", from, to, e.getMessage());
        }
    }

    private void promote(Path temp, Path to) {
        try {
            moveIntoPlace(temp, to);
        } catch (IOException e) {
            log.warn("Recovered {} but could not move it to {}: {}", temp, to, e.getMessage());
        }
    }

    private void logRecovery(Path path, RecoveredJson.Source source, Path from) {
        log.warn("Recovered {} from {} file {}", path, source.name().toLowerCase(), from.getFileName());
    }
}
