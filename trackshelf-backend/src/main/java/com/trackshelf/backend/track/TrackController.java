package com.trackshelf.backend.track;

import com.trackshelf.backend.track.dto.TrackResponse;
import com.trackshelf.backend.track.dto.TrackUploadRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/tracks")
public class TrackController {

    private final TrackService trackService;

    @PostMapping(path = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<TrackResponse> uploadTrack(
            @RequestPart("file") MultipartFile file,
            @RequestParam("title") String title,
            @RequestParam(value = "artist", required = false) String artist,
            @RequestParam(value = "album", required = false) String album,
            @RequestParam(value = "genre", required = false) String genre,
            @RequestParam(value = "cover_url", required = false) String coverUrl
    ) {
        var request = new TrackUploadRequest(title, artist, album, genre, coverUrl);
        return ResponseEntity.ok(trackService.upload(file, request));
    }

    @GetMapping
    public List<TrackResponse> listTracks(@RequestParam(value = "limit", required = false) Integer limit) {
        return trackService.list(limit);
    }

    @GetMapping("/{id}")
    public TrackResponse getTrack(@PathVariable String id) {
        return trackService.get(id);
    }
}
