package com.trackshelf.backend.track.dto;

/** Descriptive fields sent alongside the audio file. Everything but the title is optional. */
public record TrackUploadRequest(
        String title,
        String artist,
        String album,
        String genre,
        String coverUrl
) {}
