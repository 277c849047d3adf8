package com.example.recordsapi.service;

import com.example.recordsapi.access.RecordAccess;
import com.example.recordsapi.models.Record;
import com.example.recordsapi.requests.CreateRecordServiceRequest;
import com.example.recordsapi.requests.UpdateRecordServiceRequest;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Runs one record operation per call. Request bodies are validated before the store is touched,
 * every mutation runs in its own transaction, and store failures are reported as
 * {@link RecordsApiException.Code#STORAGE_FAILURE} after the transaction has been rolled back.
 */
@Service
@Slf4j
public class RecordService {

    private final RecordAccess recordAccess;
    private final Clock clock;
    private final Validator validator;

    public RecordService(RecordAccess recordAccess, Clock clock, Validator validator) {
        this.recordAccess = recordAccess;
        this.clock = clock;
        this.validator = validator;
    }

    @Transactional(readOnly = true)
    public List<Record> listRecords() {
        try {
            return recordAccess.findAll();
        } catch (DataAccessException ex) {
            throw storageFailure("Failed to list records", ex);
        }
    }

    @Transactional
    public Record createRecord(JsonNode body) {
        CreateRecordServiceRequest request = CreateRecordServiceRequest.fromBody(body);

        Instant now = Record.currentTimestamp(clock);
        Record toInsert = Record.builder()
                .name(request.name())
                .message(request.message())
                .note(request.note())
                .createdAt(now)
                .updatedAt(now)
                .build();
        requireValid(toInsert);

        Record created;
        try {
            created = recordAccess.insert(toInsert);
        } catch (DataAccessException ex) {
            throw storageFailure("Failed to create record", ex);
        }

        log.info("Created record {}", created.getId());
        return created;
    }

    /**
     * Applies a partial update to an existing record. Blank name or message values are ignored
     * rather than rejected, and updatedAt advances even when nothing else changes.
     *
     * @param id the record to update
     * @param body the raw JSON body; must be an object
     * @return the record as stored after the update
     */
    @Transactional
    public Record updateRecord(long id, JsonNode body) {
        UpdateRecordServiceRequest update = UpdateRecordServiceRequest.fromBody(body);

        Record updated;
        try {
            Record existing = recordAccess.findById(id)
                    .orElseThrow(() -> RecordsApiException.recordNotFound(id));

            existing.applyPartialUpdate(update.name(), update.message(), update.noteProvided(),
                    update.note(), Record.currentTimestamp(clock));
            requireValid(existing);

            // The row can disappear between the read and the write.
            updated = recordAccess.update(existing)
                    .orElseThrow(() -> RecordsApiException.recordNotFound(id));
        } catch (DataAccessException ex) {
            throw storageFailure("Failed to update record", ex);
        }

        log.info("Updated record {}", id);
        return updated;
    }

    @Transactional
    public void deleteRecord(long id) {
        boolean deleted;
        try {
            deleted = recordAccess.delete(id);
        } catch (DataAccessException ex) {
            throw storageFailure("Failed to delete record", ex);
        }

        if (!deleted) {
            throw RecordsApiException.recordNotFound(id);
        }
        log.info("Deleted record {}", id);
    }

    // Rows written before name/message were enforced can still hold blanks.
    private void requireValid(Record record) {
        Set<ConstraintViolation<Record>> violations = validator.validate(record);
        if (!violations.isEmpty()) {
            throw RecordsApiException.validation(CreateRecordServiceRequest.NAME_AND_MESSAGE_REQUIRED);
        }
    }

    private RecordsApiException storageFailure(String message, DataAccessException ex) {
        log.error(message, ex);
        return RecordsApiException.storageFailure(message, ex);
    }
}
