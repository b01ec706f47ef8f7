package com.chs.calculator;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.HttpMediaTypeNotAcceptableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * 모든 오류를 {"success": false, "error": "..."} 형태로 응답합니다.
 * 예상하지 못한 예외는 내부 정보를 숨기고 서버 로그에만 남깁니다.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    static final String UNEXPECTED_ERROR = "An unexpected error occurred";

    @ExceptionHandler(CalculationException.class)
    public ResponseEntity<CalculationResult> handleCalculation(CalculationException e) {
        log.error("Calculation error: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<CalculationResult> handleUnreadable(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMostSpecificCause().getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid JSON payload");
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<CalculationResult> handleMediaType(HttpMediaTypeNotSupportedException e) {
        return respond(HttpStatus.UNSUPPORTED_MEDIA_TYPE, "Content-Type must be application/json");
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<CalculationResult> handleMethod(HttpRequestMethodNotSupportedException e) {
        return respond(HttpStatus.METHOD_NOT_ALLOWED, "Method not allowed");
    }

    @ExceptionHandler({NoResourceFoundException.class, NoHandlerFoundException.class})
    public ResponseEntity<CalculationResult> handleNotFound(Exception e) {
        return respond(HttpStatus.NOT_FOUND, "Endpoint not found");
    }

    // 클라이언트가 JSON 을 받지 않으므로 본문 없이 응답
    @ExceptionHandler(HttpMediaTypeNotAcceptableException.class)
    public ResponseEntity<Void> handleNotAcceptable(HttpMediaTypeNotAcceptableException e) {
        log.warn("Not acceptable: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_ACCEPTABLE).build();
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<CalculationResult> handleUnexpected(Exception e) {
        // 자체 상태 코드를 가진 Spring 예외(ErrorResponse)는 그 상태 그대로 응답
        if (e instanceof ErrorResponse errorResponse) {
            HttpStatusCode status = errorResponse.getStatusCode();
            log.warn("Request failed with {}: {}", status.value(), e.getMessage());
            HttpStatus known = HttpStatus.resolve(status.value());
            String message = known != null ? known.getReasonPhrase() : "Request failed";
            return ResponseEntity.status(status).body(CalculationResult.failure(message));
        }

        log.error("Unexpected error: {}", e.getMessage(), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, UNEXPECTED_ERROR);
    }

    private ResponseEntity<CalculationResult> respond(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(CalculationResult.failure(message));
    }
}
