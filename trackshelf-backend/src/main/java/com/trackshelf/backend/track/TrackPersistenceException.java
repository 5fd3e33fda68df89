package com.trackshelf.backend.track;

import com.trackshelf.backend.shared.ApiException;
import org.springframework.http.HttpStatus;

/** Writing or querying track records failed for a reason other than the store being down. */
public class TrackPersistenceException extends ApiException {

    public TrackPersistenceException(String message) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, message);
    }

    public TrackPersistenceException(String message, Throwable cause) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, message, cause);
    }
}
