package com.trackshelf.backend.media;

import com.trackshelf.backend.shared.ApiException;
import org.springframework.http.HttpStatus;

public class MediaNotFoundException extends ApiException {

    public MediaNotFoundException(String message) {
        super(HttpStatus.NOT_FOUND, message);
    }
}
