package com.example.recordsapi.http;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of every error response. Only a human-readable message is exposed; causes stay in the
 * server log.
 */
public record ErrorResponse(@JsonProperty("error") String error) {}
