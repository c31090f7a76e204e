package dev.mispesos.storage;

import dev.mispesos.records.StructuredRecord;
import java.util.Map;

public class DisabledRecordStorageService implements RecordStorageService {

    @Override
    public boolean isEnabled() {
        return false;
    }

    @Override
    public String store(StructuredRecord record, Map<String, String> metadata) {
        throw new RecordStorageException("Record storage integration is disabled");
    }
}
