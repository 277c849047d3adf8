package com.example.recordsapi.requests;

import com.example.recordsapi.service.RecordsApiException;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Normalized creation payload built from a POST /api/records body. Construction fails unless
 * both name and message carry non-whitespace text; a blank note is dropped.
 */
public record CreateRecordServiceRequest(
        String name,
        String message,
        String note
) {

    public static final String NAME_AND_MESSAGE_REQUIRED = "Name and message are required";

    public CreateRecordServiceRequest {
        name = RecordFieldRules.trimToNull(name);
        message = RecordFieldRules.trimToNull(message);
        if (name == null || message == null) {
            throw RecordsApiException.validation(NAME_AND_MESSAGE_REQUIRED);
        }
        note = RecordFieldRules.trimToNull(note);
    }

    public static CreateRecordServiceRequest fromBody(JsonNode body) {
        JsonNode fields = RecordFieldRules.requireObject(body);
        return new CreateRecordServiceRequest(
                RecordFieldRules.readText(fields, "name"),
                RecordFieldRules.readText(fields, "message"),
                RecordFieldRules.readText(fields, "note")
        );
    }
}
