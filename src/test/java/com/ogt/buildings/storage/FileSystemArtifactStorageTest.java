package com.ogt.buildings.storage;

import com.ogt.buildings.config.BuildingExtractorProperties;
import com.ogt.buildings.service.ResultPackager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileSystemArtifactStorageTest {

    @TempDir
    Path dir;

    private FileSystemArtifactStorage storage;
    private Path work;

    @BeforeEach
    void setUp() throws IOException {
        BuildingExtractorProperties properties = new BuildingExtractorProperties();
        properties.getStorage().setMediaRoot(dir.resolve("media").toString());
        storage = new FileSystemArtifactStorage(properties);
        work = Files.createDirectories(dir.resolve("work"));
    }

    @Test
    void storesArchiveUnderDatedDirectory() throws IOException {
        Path archive = Files.writeString(work.resolve("Centro_20240601_100000.zip"), "zip");

        String stored = storage.storeArchive(archive, LocalDate.of(2024, 6, 1));

        assertThat(stored).isEqualTo("exports/2024/06/01/Centro_20240601_100000.zip");
        assertThat(archive).doesNotExist();
        assertThat(storage.resolve(stored)).hasContent("zip");
        assertThat(storage.sizeOf(stored)).isEqualTo(3);
    }

    @Test
    void sameNamedArchivesNeverOverwriteEachOther() throws IOException {
        String name = ResultPackager.archiveName("Centro", LocalDateTime.of(2024, 6, 1, 10, 0, 0));
        Path first = Files.writeString(Files.createDirectories(work.resolve("run-1")).resolve(name), "run-1");
        Path second = Files.writeString(Files.createDirectories(work.resolve("run-2")).resolve(name), "run-2");

        String storedFirst = storage.storeArchive(first, LocalDate.of(2024, 6, 1));
        String storedSecond = storage.storeArchive(second, LocalDate.of(2024, 6, 1));

        assertThat(storedFirst).isEqualTo("exports/2024/06/01/Centro_20240601_100000.zip");
        assertThat(storedSecond).isEqualTo("exports/2024/06/01/Centro_20240601_100000_1.zip");
        assertThat(storage.resolve(storedFirst)).hasContent("run-1");
        assertThat(storage.resolve(storedSecond)).hasContent("run-2");

        assertThat(storage.delete(storedSecond)).isTrue();
        assertThat(storage.resolve(storedFirst)).hasContent("run-1");
    }

    @Test
    void storesTilesByRunId() throws IOException {
        UUID runId = UUID.randomUUID();
        Path tiles = Files.writeString(work.resolve(runId + ".pmtiles"), "tiles");

        assertThat(storage.storeTiles(tiles, runId)).isEqualTo("tiles/" + runId + ".pmtiles");
    }

    @Test
    void deleteIsIdempotent() throws IOException {
        String stored = storage.storeArchive(Files.writeString(work.resolve("a.zip"), "a"), LocalDate.of(2024, 1, 2));

        assertThat(storage.delete(stored)).isTrue();
        assertThat(storage.delete(stored)).isFalse();
        assertThat(storage.delete(null)).isFalse();
        assertThat(storage.sizeOf(stored)).isZero();
    }

    @Test
    void refusesPathsOutsideMediaRoot() {
        assertThatThrownBy(() -> storage.resolve("../work/secret.txt")).isInstanceOf(IllegalArgumentException.class);
    }
}
