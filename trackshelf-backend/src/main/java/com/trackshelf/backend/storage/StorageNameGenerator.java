package com.trackshelf.backend.storage;

import org.springframework.stereotype.Component;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Builds the server-side name a blob is stored under: 32 hex chars of a random UUID followed by
 * the extension of the uploaded file. Nothing else from the uploader's name reaches the disk.
 */
@Component
public class StorageNameGenerator {

    private static final Pattern SAFE_EXTENSION = Pattern.compile("\\.[A-Za-z0-9]{1,16}");

    public String generate(String originalFilename) {
        return UUID.randomUUID().toString().replace("-", "") + extension(originalFilename);
    }

    /** ".mp3" for "song.mp3", "" for "README", ".bashrc" or anything with an odd extension. */
    static String extension(String originalFilename) {
        if (originalFilename == null) return "";
        String name = originalFilename.trim();
        int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        if (slash >= 0) name = name.substring(slash + 1);

        int dot = name.lastIndexOf('.');
        if (dot <= 0) return "";
        String ext = name.substring(dot);
        return SAFE_EXTENSION.matcher(ext).matches() ? ext : "";
    }
}
