package com.example.recordsapi.requests;

import com.example.recordsapi.service.RecordsApiException;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Shared parsing and normalization rules for the raw JSON bodies accepted by the record
 * endpoints.
 */
public final class RecordFieldRules {

    public static final String NO_DATA_PROVIDED = "No data provided";
    public static final String BODY_MUST_BE_OBJECT = "Request body must be a JSON object";

    private RecordFieldRules() {
    }

    /**
     * Rejects a missing body, a JSON {@code null} and anything that is not an object.
     */
    public static JsonNode requireObject(JsonNode body) {
        if (body == null || body.isNull() || body.isMissingNode()) {
            throw RecordsApiException.validation(NO_DATA_PROVIDED);
        }
        if (!body.isObject()) {
            throw RecordsApiException.validation(BODY_MUST_BE_OBJECT);
        }
        return body;
    }

    /**
     * Reads an optional string field. Absent keys and JSON {@code null} both yield {@code null};
     * numbers, booleans, arrays and objects are rejected.
     */
    public static String readText(JsonNode body, String field) {
        JsonNode node = body.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isTextual()) {
            throw RecordsApiException.validation(field + " must be a string");
        }
        return node.textValue();
    }

    public static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.strip();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
