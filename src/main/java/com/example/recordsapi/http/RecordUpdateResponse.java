package com.example.recordsapi.http;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RecordUpdateResponse(
        @JsonProperty("message") String message,
        @JsonProperty("record") RecordResponse record
) {}
