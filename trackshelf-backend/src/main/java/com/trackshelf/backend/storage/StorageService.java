package com.trackshelf.backend.storage;

import org.springframework.core.io.Resource;

import java.io.InputStream;

/**
 * Raw byte storage keyed by storage name. Names are produced by {@link StorageNameGenerator};
 * implementations refuse anything containing separators or parent segments.
 */
public interface StorageService {

    /**
     * Stores the stream under {@code name}. The blob only becomes visible once every byte is written.
     *
     * @return the number of bytes written
     * @throws StorageWriteException if anything goes wrong; nothing is left behind in that case
     */
    long write(String name, InputStream in);

    boolean exists(String name);

    /** @throws com.trackshelf.backend.media.MediaNotFoundException if there is no such blob */
    Resource load(String name);

    /** Best-effort removal; failures are logged, never thrown. */
    void delete(String name);

    /** True for names that could have come out of {@link StorageNameGenerator}. */
    static boolean isValidName(String name) {
        return name != null
                && !name.isBlank()
                && !name.startsWith(".")
                && !name.contains("/")
                && !name.contains("\\")
                && !name.contains("..");
    }
}
