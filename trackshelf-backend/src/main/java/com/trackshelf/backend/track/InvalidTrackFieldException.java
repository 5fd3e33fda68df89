package com.trackshelf.backend.track;

import com.trackshelf.backend.shared.ApiException;
import org.springframework.http.HttpStatus;

/** A descriptive upload field or query parameter failed validation. */
public class InvalidTrackFieldException extends ApiException {

    public InvalidTrackFieldException(String message) {
        super(HttpStatus.BAD_REQUEST, message);
    }
}
