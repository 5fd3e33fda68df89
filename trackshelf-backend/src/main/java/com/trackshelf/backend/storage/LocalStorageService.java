package com.trackshelf.backend.storage;

import com.trackshelf.backend.media.MediaNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.*;

@Slf4j
@Service
public class LocalStorageService implements StorageService {

    private static final String STAGING_DIR = ".incoming";

    private final Path rootDir;       // e.g. /var/app/uploads
    private final Path stagingDir;    // partial writes live here until moved into rootDir

    public LocalStorageService(@Value("${app.upload.root:uploads}") String uploadRoot) throws IOException {
        this.rootDir = Path.of(uploadRoot).toAbsolutePath().normalize();
        this.stagingDir = rootDir.resolve(STAGING_DIR);
        Files.createDirectories(this.stagingDir);
        log.info("Storing uploads under {}", rootDir);
    }

    @Override
    public long write(String name, InputStream in) {
        Path target = resolve(name);
        Path tmp = null;
        try {
            tmp = Files.createTempFile(stagingDir, "upload-", ".part");
            long size = Files.copy(in, tmp, StandardCopyOption.REPLACE_EXISTING);
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE);
            return size;
        } catch (IOException e) {
            discard(tmp);
            throw new StorageWriteException("Failed to save file", e);
        }
    }

    @Override
    public boolean exists(String name) {
        return StorageService.isValidName(name) && Files.isRegularFile(rootDir.resolve(name));
    }

    @Override
    public Resource load(String name) {
        if (!exists(name)) {
            throw new MediaNotFoundException("File not found");
        }
        return new FileSystemResource(rootDir.resolve(name));
    }

    @Override
    public void delete(String name) {
        if (!StorageService.isValidName(name)) return;
        try {
            Files.deleteIfExists(rootDir.resolve(name));
        } catch (IOException e) {
            log.warn("Could not delete stored file {}", name, e);
        }
    }

    private Path resolve(String name) {
        if (!StorageService.isValidName(name)) {
            throw new StorageWriteException("Refusing to store file under name '" + name + "'");
        }
        return rootDir.resolve(name);
    }

    private static void discard(Path tmp) {
        if (tmp == null) return;
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("Could not remove partial upload {}", tmp, e);
        }
    }
}
