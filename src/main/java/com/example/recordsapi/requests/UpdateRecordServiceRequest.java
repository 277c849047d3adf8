package com.example.recordsapi.requests;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Partial update parsed from a PUT /api/records/{id} body.
 *
 * <p>{@code name} and {@code message} are {@code null} when they should be left alone, which
 * covers both a missing key and a blank value. {@code note} is only meaningful when
 * {@code noteProvided} is set; in that case a {@code null} note clears the stored one.
 */
public record UpdateRecordServiceRequest(
        String name,
        String message,
        boolean noteProvided,
        String note
) {

    public UpdateRecordServiceRequest {
        name = RecordFieldRules.trimToNull(name);
        message = RecordFieldRules.trimToNull(message);
        note = noteProvided ? RecordFieldRules.trimToNull(note) : null;
    }

    public static UpdateRecordServiceRequest fromBody(JsonNode body) {
        JsonNode fields = RecordFieldRules.requireObject(body);
        return new UpdateRecordServiceRequest(
                RecordFieldRules.readText(fields, "name"),
                RecordFieldRules.readText(fields, "message"),
                fields.has("note"),
                RecordFieldRules.readText(fields, "note")
        );
    }
}
