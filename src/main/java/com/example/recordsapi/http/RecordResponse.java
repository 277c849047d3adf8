package com.example.recordsapi.http;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

// note is written as null rather than omitted
@JsonInclude(JsonInclude.Include.ALWAYS)
public record RecordResponse(
        @JsonProperty("id") Long id,
        @JsonProperty("name") String name,
        @JsonProperty("message") String message,
        @JsonProperty("note") String note,
        @JsonProperty("createdAt") String createdAt,
        @JsonProperty("updatedAt") String updatedAt
) {}
