package com.funnelanalytics.api;

import com.funnelanalytics.domain.exception.AnalysisCancelledException;
import com.funnelanalytics.domain.exception.ErrorKind;
import com.funnelanalytics.domain.exception.FunnelNotFoundException;
import com.funnelanalytics.domain.exception.InvalidFunnelDefinitionException;
import com.funnelanalytics.domain.exception.UnknownSegmentDimensionException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();
    
    @Test
    void testEveryKindHasAStatus() {
        for (ErrorKind kind : ErrorKind.values()) {
            assertNotNull(GlobalExceptionHandler.statusOf(kind));
        }
    }
    
    @Test
    void testInvalidDefinition_BadRequestWithViolations() {
        ResponseEntity<Map<String, Object>> response = handler.handleFunnelAnalysisException(
                new InvalidFunnelDefinitionException(List.of("Step 1 has no name")));
        
        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals("INVALID_FUNNEL_DEFINITION", response.getBody().get("kind"));
        assertEquals(List.of("Step 1 has no name"), response.getBody().get("details"));
    }
    
    @Test
    void testUnknownDimension_BadRequest() {
        ResponseEntity<Map<String, Object>> response = handler.handleFunnelAnalysisException(
                new UnknownSegmentDimensionException("color"));
        
        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals("UNKNOWN_SEGMENT_DIMENSION", response.getBody().get("kind"));
    }
    
    @Test
    void testNotFound() {
        ResponseEntity<Map<String, Object>> response = handler.handleFunnelAnalysisException(
                new FunnelNotFoundException(UUID.randomUUID()));
        
        assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
        assertEquals(404, response.getBody().get("status"));
    }
    
    @Test
    void testCancelled_ServiceUnavailable() {
        ResponseEntity<Map<String, Object>> response = handler.handleFunnelAnalysisException(
                new AnalysisCancelledException("exceeded its deadline"));
        
        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, response.getStatusCode());
        assertEquals("exceeded its deadline", response.getBody().get("message"));
    }
    
    @Test
    void testUnexpectedError_GenericMessage() {
        ResponseEntity<Map<String, Object>> response = handler.handleGenericException(
                new IllegalStateException("connection refused to 10.0.0.3"));
        
        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
        assertEquals("An unexpected error occurred", response.getBody().get("message"));
    }
}
