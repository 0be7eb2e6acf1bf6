package com.foodvision.backend.scan.storage;

import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.FileNotFoundException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;

@Getter
@Service
public class LocalDiskStorageService implements StorageService {

    private final Path baseDir;

    public LocalDiskStorageService(@Value("${app.storage.local.base-dir:./uploads}") String baseDir) {
        this.baseDir = Paths.get(baseDir).toAbsolutePath().normalize();
    }

    @Override
    public SaveResult save(String objectKey, InputStream in, String contentType) throws Exception {
        Path path = resolve(objectKey);
        Files.createDirectories(path.getParent());

        long size = 0;
        try (InputStream src = in;
             OutputStream out = Files.newOutputStream(path, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING)) {
            byte[] buf = new byte[8192];
            int n;
            while ((n = src.read(buf)) >= 0) {
                out.write(buf, 0, n);
                size += n;
            }
        }
        return new SaveResult(objectKey, size, contentType);
    }

    @Override
    public SaveResult save(String objectKey, byte[] bytes, String contentType) throws Exception {
        return save(objectKey, new ByteArrayInputStream(bytes == null ? new byte[0] : bytes), contentType);
    }

    @Override
    public OpenResult open(String objectKey) throws Exception {
        Path path = resolve(objectKey);
        if (!Files.exists(path)) throw new FileNotFoundException("OBJECT_NOT_FOUND: " + objectKey);

        String ct = Files.probeContentType(path);
        long size = Files.size(path);
        InputStream in = Files.newInputStream(path, StandardOpenOption.READ);
        return new OpenResult(in, size, ct);
    }

    @Override
    public byte[] readAllBytes(String objectKey) throws Exception {
        Path path = resolve(objectKey);
        if (!Files.exists(path)) throw new FileNotFoundException("OBJECT_NOT_FOUND: " + objectKey);
        return Files.readAllBytes(path);
    }

    @Override
    public boolean delete(String objectKey) throws Exception {
        return Files.deleteIfExists(resolve(objectKey));
    }

    @Override
    public boolean exists(String objectKey) throws Exception {
        return Files.exists(resolve(objectKey));
    }

    private Path resolve(String objectKey) {
        if (objectKey == null || objectKey.isBlank()) throw new IllegalArgumentException("OBJECT_KEY_REQUIRED");
        Path p = baseDir.resolve(objectKey).normalize();
        // 擋 ../ 跳出 base-dir
        if (!p.startsWith(baseDir) || p.equals(baseDir)) throw new SecurityException("Invalid objectKey");
        return p;
    }
}
