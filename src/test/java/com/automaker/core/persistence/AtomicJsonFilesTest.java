package com.automaker.core.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.CopyOption;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AtomicJsonFilesTest {

    @TempDir
    Path dir;

    private AtomicJsonFiles files;
    private Path target;

    @BeforeEach
    void setUp() {
        files = new AtomicJsonFiles(new ObjectMapper().findAndRegisterModules(), 3);
        target = dir.resolve("data.json");
    }

    // -- write tests ---

    @Nested
    @DisplayName("write")
    class WriteTests {

        @Test
        @DisplayName("leaves no temp file behind")
        void noTempFileLeft() throws Exception {
            files.write(target, Map.of("v", 1), true);

            assertTrue(Files.exists(target));
            try (var entries = Files.list(dir)) {
                assertTrue(entries.noneMatch(p -> p.getFileName().toString().contains(".tmp.")));
            }
        }

        @Test
        @DisplayName("falls back to a replacing move when atomic moves are unsupported")
        void fallsBackWithoutAtomicMove() throws Exception {
            List<List<CopyOption>> moves = new ArrayList<>();
            AtomicJsonFiles noAtomic = new AtomicJsonFiles(new ObjectMapper().findAndRegisterModules(), 3) {
                @Override
                void move(Path from, Path to, CopyOption... options) throws IOException {
                    moves.add(List.of(options));
                    if (List.of(options).contains(StandardCopyOption.ATOMIC_MOVE)) {
                        throw new AtomicMoveNotSupportedException(from.toString(), to.toString(), "unsupported");
                    }
                    super.move(from, to, options);
                }
            };

            noAtomic.write(target, Map.of("v", 1), false);

            assertEquals(1, readV(target));
            assertEquals(2, moves.size());
            assertEquals(List.of(StandardCopyOption.REPLACE_EXISTING), moves.get(1));
            try (var entries = Files.list(dir)) {
                assertTrue(entries.noneMatch(p -> p.getFileName().toString().contains(".tmp.")));
            }
        }

        @Test
        @DisplayName("rotates previous content into numbered backups")
        void rotatesBackups() {
            files.write(target, Map.of("v", 1), true);
            files.write(target, Map.of("v", 2), true);
            files.write(target, Map.of("v", 3), true);

            assertEquals(2, readV(AtomicJsonFiles.backupPath(target, 1)));
            assertEquals(1, readV(AtomicJsonFiles.backupPath(target, 2)));
            assertEquals(3, readV(target));
        }

        @Test
        @DisplayName("keeps at most the configured number of backups")
        void capsBackups() {
            for (int i = 1; i <= 6; i++) {
                files.write(target, Map.of("v", i), true);
            }

            assertTrue(Files.exists(AtomicJsonFiles.backupPath(target, 3)));
            assertFalse(Files.exists(AtomicJsonFiles.backupPath(target, 4)));
            assertEquals(3, readV(AtomicJsonFiles.backupPath(target, 3)));
        }

        @Test
        @DisplayName("skips backups when not requested")
        void withoutBackups() {
            files.write(target, Map.of("v", 1), false);
            files.write(target, Map.of("v", 2), false);

            assertFalse(Files.exists(AtomicJsonFiles.backupPath(target, 1)));
        }
    }

    // -- recovery tests ---

    @Nested
    @DisplayName("readWithRecovery")
    class RecoveryTests {

        @Test
        @DisplayName("reads the main file when it is intact")
        void readsMain() {
            files.write(target, Map.of("v", 7), true);

            RecoveredJson<Map> result = files.readWithRecovery(target, Map.class, null);

            assertEquals(RecoveredJson.Source.MAIN, result.source());
            assertFalse(result.recovered());
            assertEquals(7, result.data().get("v"));
        }

        @Test
        @DisplayName("falls back to the newest backup when the main file is corrupt")
        void recoversFromBackup() throws Exception {
            files.write(target, Map.of("v", 1), true);
            files.write(target, Map.of("v", 2), true);
            Files.writeString(target, "{ not json");

            RecoveredJson<Map> result = files.readWithRecovery(target, Map.class, null);

            assertTrue(result.recovered());
            assertEquals(RecoveredJson.Source.BACKUP, result.source());
            assertEquals(1, result.data().get("v"));
            assertEquals(1, readV(target));
        }

        @Test
        @DisplayName("promotes a leftover temp file when the main file is missing")
        void recoversFromTempFile() throws Exception {
            Path temp = dir.resolve("data.json.tmp.12345");
            Files.writeString(temp, "{\"v\":5}");

            RecoveredJson<Map> result = files.readWithRecovery(target, Map.class, null);

            assertEquals(RecoveredJson.Source.TEMP, result.source());
            assertEquals(5, result.data().get("v"));
            assertTrue(Files.exists(target));
            assertFalse(Files.exists(temp));
        }

        @Test
        @DisplayName("returns the default when nothing is readable")
        void returnsDefault() {
            RecoveredJson<Map> result = files.readWithRecovery(target, Map.class, Map.of("v", 0));

            assertEquals(RecoveredJson.Source.DEFAULT, result.source());
            assertFalse(result.recovered());
            assertEquals("File not found", result.error());
            assertEquals(0, result.data().get("v"));
        }
    }

    private int readV(Path path) {
        try {
            return (Integer) new ObjectMapper().readValue(path.toFile(), Map.class).get("v");
        } catch (Exception e) {
            throw new AssertionError("Unreadable " + path, e);
        }
    }
}
