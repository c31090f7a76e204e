package dev.mispesos.storage;

public class RecordStorageException extends RuntimeException {

    public RecordStorageException(String message) {
        super(message);
    }

    public RecordStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
