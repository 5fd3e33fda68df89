package com.trackshelf.backend.track;

import com.trackshelf.backend.shared.ApiException;
import org.springframework.http.HttpStatus;

public class InvalidContentTypeException extends ApiException {

    public InvalidContentTypeException(String message) {
        super(HttpStatus.BAD_REQUEST, message);
    }
}
