package com.company.consolidation.exception;

public class InvalidBatchRequestException extends RuntimeException {
    public InvalidBatchRequestException(String message) {
        super(message);
    }
}
