package com.trackshelf.backend.track;

import com.trackshelf.backend.media.MediaUrlBuilder;
import com.trackshelf.backend.shared.ApiException;
import com.trackshelf.backend.storage.StorageNameGenerator;
import com.trackshelf.backend.storage.StorageService;
import com.trackshelf.backend.storage.StorageWriteException;
import com.trackshelf.backend.track.dto.TrackResponse;
import com.trackshelf.backend.track.dto.TrackUploadRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class TrackService {

    private final StorageService storage;
    private final StorageNameGenerator nameGenerator;
    private final TrackStore trackStore;
    private final MediaUrlBuilder urlBuilder;

    /**
     * Stores the file first and the record second. If the record cannot be saved the file is
     * removed again, so a track is never visible without its bytes.
     */
    public TrackResponse upload(MultipartFile file, TrackUploadRequest request) {
        TrackValidator.requireAudio(file.getContentType());
        TrackValidator.requireValidFields(request);

        String originalFilename = file.getOriginalFilename() == null ? "" : file.getOriginalFilename();
        String storageName = nameGenerator.generate(originalFilename);

        long size;
        try (InputStream in = file.getInputStream()) {
            size = storage.write(storageName, in);
        } catch (IOException e) {
            throw new StorageWriteException("Failed to save file", e);
        }

        Track track = new Track();
        track.setTitle(request.title().trim());
        track.setArtist(blankToNull(request.artist()));
        track.setAlbum(blankToNull(request.album()));
        track.setGenre(blankToNull(request.genre()));
        track.setCoverUrl(blankToNull(request.coverUrl()));
        track.setFilename(storageName);
        track.setOriginalFilename(originalFilename);
        track.setContentType(file.getContentType());
        track.setFileSize(size);

        Track saved;
        try {
            saved = trackStore.insert(track);
        } catch (RuntimeException e) {
            log.warn("Saving track '{}' failed, removing stored file {}", track.getTitle(), storageName);
            storage.delete(storageName);
            throw e instanceof ApiException ? e : new TrackPersistenceException("Database error while saving track", e);
        }

        log.info("Uploaded track {} as {} ({} bytes)", saved.getId(), storageName, size);
        return toResponse(saved);
    }

    public List<TrackResponse> list(Integer limit) {
        TrackValidator.requireValidLimit(limit);
        return trackStore.list(limit).stream()
                .map(this::toResponse)
                .toList();
    }

    public TrackResponse get(String id) {
        return toResponse(trackStore.getById(id));
    }

    private TrackResponse toResponse(Track track) {
        return TrackResponse.of(track, urlBuilder.build(track.getFilename()));
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
