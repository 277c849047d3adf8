package com.example.recordsapi.http;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record RecordListResponse(
        @JsonProperty("records") List<RecordResponse> records,
        @JsonProperty("total") int total
) {}
