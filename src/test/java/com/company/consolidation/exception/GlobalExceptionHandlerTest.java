package com.company.consolidation.exception;

import com.company.consolidation.dto.response.ConsolidationResponse;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void shouldIncludeCauseInStorageFailure() {
        ResponseEntity<ConsolidationResponse> response = handler.handleStorageFailure(
                new AlertStorageException("Failed to fetch unconsolidated alerts",
                        new IllegalStateException("pool exhausted")));

        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
        assertEquals(ConsolidationResponse.FAILED, response.getBody().getMessage());
        assertEquals("Failed to fetch unconsolidated alerts: pool exhausted", response.getBody().getError());
        assertNull(response.getBody().getResults());
    }

    @Test
    void shouldUseOwnMessageWithoutCause() {
        ResponseEntity<ConsolidationResponse> response = handler.handleStorageFailure(
                new AlertStorageException("Failed to save alert x", null));

        assertEquals("Failed to save alert x", response.getBody().getError());
    }

    @Test
    void shouldMapNotFound() {
        ResponseEntity<Map<String, Object>> response =
                handler.handleAlertNotFound(new AlertNotFoundException("abc"));

        assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
        assertEquals(404, response.getBody().get("status"));
        assertEquals("Not Found", response.getBody().get("error"));
        assertEquals("Alert not found: abc", response.getBody().get("message"));
        assertNotNull(response.getBody().get("timestamp"));
    }

    @Test
    void shouldWrapUnexpectedErrors() {
        ResponseEntity<ConsolidationResponse> response =
                handler.handleGenericException(new IllegalStateException("boom"));

        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
        assertEquals("boom", response.getBody().getError());
    }
}
