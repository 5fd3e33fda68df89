package com.trackshelf.backend.track;

import com.trackshelf.backend.shared.ApiException;
import org.springframework.http.HttpStatus;

public class InvalidTrackIdException extends ApiException {

    public InvalidTrackIdException(String message) {
        super(HttpStatus.BAD_REQUEST, message);
    }
}
