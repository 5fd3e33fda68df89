package com.trackshelf.backend.track.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.trackshelf.backend.track.Track;

import java.time.Instant;

public record TrackResponse(
        @JsonProperty("id") String id,
        @JsonProperty("title") String title,
        @JsonProperty("artist") String artist,
        @JsonProperty("album") String album,
        @JsonProperty("genre") String genre,
        @JsonProperty("cover_url") String coverUrl,
        @JsonProperty("filename") String filename,
        @JsonProperty("original_filename") String originalFilename,
        @JsonProperty("content_type") String contentType,
        @JsonProperty("file_size") long fileSize,
        @JsonProperty("media_url") String mediaUrl,
        @JsonProperty("created_at") Instant createdAt
) {

    public static TrackResponse of(Track track, String mediaUrl) {
        return new TrackResponse(
                String.valueOf(track.getId()),
                track.getTitle(),
                track.getArtist(),
                track.getAlbum(),
                track.getGenre(),
                track.getCoverUrl(),
                track.getFilename(),
                track.getOriginalFilename(),
                track.getContentType(),
                track.getFileSize(),
                mediaUrl,
                track.getCreatedAt()
        );
    }
}
