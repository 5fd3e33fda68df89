package com.trackshelf.backend.track;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;

@Entity
@Table(name = "track", indexes = @Index(name = "idx_track_created_at", columnList = "created_at"))
@Getter
@Setter
@NoArgsConstructor
public class Track {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String title;

    @Column(columnDefinition = "TEXT")
    private String artist;

    @Column(columnDefinition = "TEXT")
    private String album;

    @Column(columnDefinition = "TEXT")
    private String genre;

    @Column(name = "cover_url", columnDefinition = "TEXT")
    private String coverUrl;

    // server-generated storage name, never the uploader's
    @Column(nullable = false, unique = true, updatable = false)
    private String filename;

    @Column(name = "original_filename", nullable = false, updatable = false, columnDefinition = "TEXT")
    private String originalFilename;

    @Column(name = "content_type", nullable = false, updatable = false, columnDefinition = "TEXT")
    private String contentType;

    @Column(name = "file_size", nullable = false, updatable = false)
    private long fileSize;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
