package com.example.medialibrary.common.exception;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import com.example.medialibrary.api.response.ApiResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.http.ResponseEntity;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void shouldMapSymbolicCodesToHttpStatus() {
        assertEquals(400, new BusinessException("LIBRARY_NO_FOLDERS", "none").getHttpStatus());
        assertEquals(409, new BusinessException("COLLECTION_ORDER_MISMATCH", "order").getHttpStatus());
        assertEquals(503, new BusinessException("TASK_EXECUTOR_REJECTED", "busy").getHttpStatus());
        assertEquals(404, new BusinessException("404", "missing").getHttpStatus());
        assertEquals(400, new BusinessException("SOMETHING_ELSE", "x").getHttpStatus());
    }

    @Test
    void shouldKeepCodeAndUserActionInBody() {
        ResponseEntity<ApiResponse<Void>> response = handler.handleBusinessException(
                new BusinessException("409", "A library scan is already running", "Wait for it to complete"));

        assertEquals(409, response.getStatusCodeValue());
        assertEquals("409", response.getBody().getCode());
        assertEquals("Wait for it to complete", response.getBody().getUserAction());
        assertNull(response.getBody().getData());
    }

    @Test
    void shouldAnswerConflictForDuplicateKey() {
        ResponseEntity<ApiResponse<Void>> response = handler.handleDuplicateKeyException(
                new DuplicateKeyException("Duplicate entry 'UC1' for key 'uk_channel_id'"));

        assertEquals(409, response.getStatusCodeValue());
        assertEquals("409", response.getBody().getCode());
    }

    @Test
    void shouldHideUnexpectedErrors() {
        ResponseEntity<ApiResponse<Void>> response = handler.handleException(new IllegalStateException("boom"));

        assertEquals(500, response.getStatusCodeValue());
        assertEquals("Internal error", response.getBody().getMessage());
    }
}
