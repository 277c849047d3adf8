package com.example.recordsapi.service;

import lombok.Getter;

public class RecordsApiException extends RuntimeException {

    public enum Code {
        VALIDATION_FAILED,
        RECORD_NOT_FOUND,
        STORAGE_FAILURE
    }

    @Getter
    private final Code code;

    private RecordsApiException(Code code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public static RecordsApiException validation(String message) {
        return new RecordsApiException(Code.VALIDATION_FAILED, message, null);
    }

    public static RecordsApiException recordNotFound(long id) {
        return new RecordsApiException(Code.RECORD_NOT_FOUND,
                "Record " + id + " not found", null);
    }

    public static RecordsApiException storageFailure(String message, Throwable cause) {
        return new RecordsApiException(Code.STORAGE_FAILURE, message, cause);
    }
}
