package com.example.recordsapi.http;

import com.example.recordsapi.models.Record;
import com.example.recordsapi.service.RecordService;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST entry point for records. Bodies are taken as raw JSON trees so the service can tell a
 * missing key from a blank one when applying partial updates.
 */
@RestController
@RequestMapping("/api/records")
public class RecordController {

    static final String UPDATED_MESSAGE = "Record updated successfully";
    static final String DELETED_MESSAGE = "Record deleted successfully";

    private final RecordService recordService;

    public RecordController(RecordService recordService) {
        this.recordService = recordService;
    }

    @GetMapping
    public ResponseEntity<RecordListResponse> getAllRecords() {
        List<RecordResponse> records = recordService.listRecords().stream()
                .map(this::map)
                .toList();
        return ResponseEntity.ok(new RecordListResponse(records, records.size()));
    }

    @PostMapping
    public ResponseEntity<RecordResponse> createRecord(@RequestBody(required = false) JsonNode body) {
        Record record = recordService.createRecord(body);
        return ResponseEntity.status(HttpStatus.CREATED).body(map(record));
    }

    @PutMapping("/{id}")
    public ResponseEntity<RecordUpdateResponse> updateRecord(
            @PathVariable("id") long id,
            @RequestBody(required = false) JsonNode body
    ) {
        Record record = recordService.updateRecord(id, body);
        return ResponseEntity.ok(new RecordUpdateResponse(UPDATED_MESSAGE, map(record)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<MessageResponse> deleteRecord(@PathVariable("id") long id) {
        recordService.deleteRecord(id);
        return ResponseEntity.ok(new MessageResponse(DELETED_MESSAGE));
    }

    private RecordResponse map(Record record) {
        return new RecordResponse(
                record.getId(),
                record.getName(),
                record.getMessage(),
                record.getNote(),
                Record.formatTimestamp(record.getCreatedAt()),
                Record.formatTimestamp(record.getUpdatedAt())
        );
    }
}
