package com.example.recordsapi.http;

import com.fasterxml.jackson.annotation.JsonProperty;

public record MessageResponse(@JsonProperty("message") String message) {}
