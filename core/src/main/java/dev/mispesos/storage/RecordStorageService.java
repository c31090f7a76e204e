package dev.mispesos.storage;

import dev.mispesos.records.StructuredRecord;
import java.util.Map;

/**
 * Persists finished structured records. Implementations live outside the interpretation
 * service; only the contract is defined here.
 */
public interface RecordStorageService {

    boolean isEnabled();

    /**
     * Store a successful record.
     *
     * @param record   record with a positive amount
     * @param metadata free-form attributes describing where the record came from
     * @return identifier assigned by the storage
     * @throws RecordStorageException when the record could not be stored
     */
    String store(StructuredRecord record, Map<String, String> metadata);
}
