package com.trackshelf.backend.track;

import com.trackshelf.backend.track.dto.TrackUploadRequest;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/** Input checks for uploads and listings. All of them run before anything touches disk or database. */
final class TrackValidator {

    private TrackValidator() {}

    static void requireAudio(String contentType) {
        if (contentType == null || !contentType.toLowerCase(Locale.ROOT).startsWith("audio/")) {
            throw new InvalidContentTypeException("Only audio files are allowed");
        }
    }

    static void requireValidFields(TrackUploadRequest request) {
        if (request == null || request.title() == null || request.title().isBlank()) {
            throw new InvalidTrackFieldException("Title is required");
        }
        String cover = request.coverUrl();
        if (cover != null && !cover.isBlank() && !isAbsoluteHttpUrl(cover.trim())) {
            throw new InvalidTrackFieldException("cover_url must be an absolute http(s) URL");
        }
    }

    static void requireValidLimit(Integer limit) {
        if (limit != null && limit < 0) {
            throw new InvalidTrackFieldException("limit must not be negative");
        }
    }

    private static boolean isAbsoluteHttpUrl(String value) {
        try {
            URI uri = new URI(value);
            String scheme = uri.getScheme();
            return uri.isAbsolute()
                    && ("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))
                    && uri.getHost() != null;
        } catch (URISyntaxException e) {
            return false;
        }
    }
}
