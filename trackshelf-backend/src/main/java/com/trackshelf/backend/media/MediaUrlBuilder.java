package com.trackshelf.backend.media;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/** Public link for a stored file: {@code <base>/media/<filename>}, or root-relative without a base. */
@Component
public class MediaUrlBuilder {

    private final String publicBase;  // e.g. https://api.example.com, or "" for relative links

    public MediaUrlBuilder(@Value("${app.public-base-url:}") String publicBase) {
        this.publicBase = publicBase == null ? "" : publicBase.trim().replaceAll("/+$", "");
    }

    public String build(String filename) {
        return publicBase + "/media/" + filename;
    }
}
