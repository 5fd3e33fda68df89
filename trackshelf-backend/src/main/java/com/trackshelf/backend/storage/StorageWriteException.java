package com.trackshelf.backend.storage;

import com.trackshelf.backend.shared.ApiException;
import org.springframework.http.HttpStatus;

public class StorageWriteException extends ApiException {

    public StorageWriteException(String message) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, message);
    }

    public StorageWriteException(String message, Throwable cause) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, message, cause);
    }
}
