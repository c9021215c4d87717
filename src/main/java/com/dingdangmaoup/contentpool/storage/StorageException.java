package com.dingdangmaoup.contentpool.storage;

import com.dingdangmaoup.contentpool.model.ManifestId;
import lombok.Getter;

/**
 * Failure inside the storage layer: I/O errors, missing source files,
 * hash mismatches and unreadable manifest records
 */
@Getter
public class StorageException extends RuntimeException {

    private final ManifestId manifestId;

    public StorageException(String message) {
        this(message, null, null);
    }

    public StorageException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public StorageException(String message, ManifestId manifestId) {
        this(message, manifestId, null);
    }

    public StorageException(String message, ManifestId manifestId, Throwable cause) {
        super(message, cause);
        this.manifestId = manifestId;
    }
}
