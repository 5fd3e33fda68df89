package com.trackshelf.backend.system;

import com.trackshelf.backend.shared.ApiException;
import com.trackshelf.backend.track.TrackStore;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequiredArgsConstructor
public class SystemController {

    private final TrackStore trackStore;

    @Value("${app.upload.root:uploads}")
    private String uploadRoot;

    @Value("${spring.datasource.url:}")
    private String datasourceUrl;

    @GetMapping("/")
    public Map<String, String> root() {
        return Map.of("message", "Music Upload API ready");
    }

    @GetMapping("/api/hello")
    public Map<String, String> hello() {
        return Map.of("message", "Hello from the backend API!");
    }

    /** Diagnostics: is the backend up and can it reach its database. Never fails itself. */
    @GetMapping("/test")
    public Map<String, Object> status() {
        Map<String, Object> report = new LinkedHashMap<>();
        report.put("backend", "Running");
        report.put("database_url", datasourceUrl == null || datasourceUrl.isBlank() ? "Not Set" : "Set");
        report.put("upload_dir", uploadRoot == null || uploadRoot.isBlank() ? "Not Set" : "Set");
        try {
            long tracks = trackStore.count();
            report.put("database", "Connected & Working");
            report.put("connection_status", "Connected");
            report.put("track_count", tracks);
        } catch (ApiException e) {
            report.put("database", "Error: " + e.getMessage());
            report.put("connection_status", "Not Connected");
        }
        return report;
    }
}
