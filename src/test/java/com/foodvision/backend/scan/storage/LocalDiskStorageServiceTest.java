package com.foodvision.backend.scan.storage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.FileNotFoundException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class LocalDiskStorageServiceTest {

    @TempDir
    Path dir;

    @Test
    void save_open_delete() throws Exception {
        LocalDiskStorageService storage = new LocalDiskStorageService(dir.toString());

        StorageService.SaveResult saved = storage.save("a.jpg", new ByteArrayInputStream(new byte[] {1, 2, 3}), "image/jpeg");
        assertThat(saved.sizeBytes()).isEqualTo(3);
        assertThat(Files.exists(dir.resolve("a.jpg"))).isTrue();

        StorageService.OpenResult opened = storage.open("a.jpg");
        try (InputStream in = opened.inputStream()) {
            assertThat(in.readAllBytes()).containsExactly(1, 2, 3);
        }
        assertThat(opened.sizeBytes()).isEqualTo(3);

        assertThat(storage.delete("a.jpg")).isTrue();
        assertThat(storage.delete("a.jpg")).isFalse();
        assertThat(storage.exists("a.jpg")).isFalse();
    }

    @Test
    void missing_object_is_file_not_found() {
        LocalDiskStorageService storage = new LocalDiskStorageService(dir.toString());

        assertThatThrownBy(() -> storage.open("nope.png")).isInstanceOf(FileNotFoundException.class);
        assertThatThrownBy(() -> storage.readAllBytes("nope.png")).isInstanceOf(FileNotFoundException.class);
    }

    @Test
    void path_traversal_rejected() {
        LocalDiskStorageService storage = new LocalDiskStorageService(dir.toString());

        assertThatThrownBy(() -> storage.open("../etc/passwd")).isInstanceOf(SecurityException.class);
        assertThatThrownBy(() -> storage.save(" ", new byte[] {1}, "image/png"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("OBJECT_KEY_REQUIRED");
    }
}
