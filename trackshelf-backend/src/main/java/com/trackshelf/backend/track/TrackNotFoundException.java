package com.trackshelf.backend.track;

import com.trackshelf.backend.shared.ApiException;
import org.springframework.http.HttpStatus;

public class TrackNotFoundException extends ApiException {

    public TrackNotFoundException(String message) {
        super(HttpStatus.NOT_FOUND, message);
    }
}
