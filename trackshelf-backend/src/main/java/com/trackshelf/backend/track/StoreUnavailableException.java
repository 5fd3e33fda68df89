package com.trackshelf.backend.track;

import com.trackshelf.backend.shared.ApiException;
import org.springframework.http.HttpStatus;

/** The metadata database cannot be reached. Distinct from a missing record. */
public class StoreUnavailableException extends ApiException {

    public StoreUnavailableException(String message) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, message, cause);
    }
}
