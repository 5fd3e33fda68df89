package com.trackshelf.backend.media;

import com.trackshelf.backend.storage.StorageService;
import com.trackshelf.backend.track.StoreUnavailableException;
import com.trackshelf.backend.track.Track;
import com.trackshelf.backend.track.TrackPersistenceException;
import com.trackshelf.backend.track.TrackStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

/**
 * Streams stored files back. Returning a {@link Resource} lets Spring MVC answer {@code Range}
 * requests with 206 Partial Content.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class MediaController {

    private final StorageService storage;
    private final TrackStore trackStore;

    @GetMapping("/media/{filename}")
    public ResponseEntity<Resource> serveMedia(@PathVariable String filename) {
        Resource resource = storage.load(filename);
        return ResponseEntity.ok()
                .contentType(contentTypeOf(filename))
                .body(resource);
    }

    // The record is only consulted for its content type; a missing record or a down database is not fatal.
    private MediaType contentTypeOf(String filename) {
        String stored;
        try {
            stored = trackStore.findByFilename(filename).map(Track::getContentType).orElse(null);
        } catch (StoreUnavailableException | TrackPersistenceException e) {
            log.debug("No content type for {}: {}", filename, e.getMessage());
            stored = null;
        }
        if (stored == null || stored.isBlank()) return MediaType.APPLICATION_OCTET_STREAM;
        try {
            return MediaType.parseMediaType(stored);
        } catch (InvalidMediaTypeException e) {
            return MediaType.APPLICATION_OCTET_STREAM;
        }
    }
}
