package com.mobifone.compute.exception;

import com.mobifone.compute.dto.ApiResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.util.Objects;

@ControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(value = Exception.class)
    ResponseEntity<ApiResponse> handlingRuntimeException(Exception exception) {
        // Spring MVC errors (404, 405, 415, ...) keep their own status
        if (exception instanceof ErrorResponse errorResponse) {
            log.warn("Request rejected: {}", exception.getMessage());
            return toResponse(errorResponse.getStatusCode(), ErrorCode.REQUEST_REJECTED.getCode(), exception.getMessage());
        }
        log.error("Unhandled exception: ", exception);
        return toResponse(ErrorCode.UNCATEGORIZED_EXCEPTION, ErrorCode.UNCATEGORIZED_EXCEPTION.getMessage());
    }

    @ExceptionHandler(value = AppException.class)
    ResponseEntity<ApiResponse> handlingAppException(AppException exception) {
        ErrorCode errorCode = exception.getErrorCode();
        log.error("{}: {}", errorCode, exception.getMessage());
        return toResponse(errorCode, exception.getMessage());
    }

    @ExceptionHandler(value = MethodArgumentNotValidException.class)
    ResponseEntity<ApiResponse> handlingValidation(MethodArgumentNotValidException exception) {
        String message = exception.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + " " + Objects.requireNonNullElse(e.getDefaultMessage(), "is invalid"))
                .findFirst()
                .orElse(ErrorCode.INVALID_KEY.getMessage());
        return toResponse(ErrorCode.INVALID_KEY, message);
    }

    @ExceptionHandler(value = {MissingServletRequestParameterException.class, HttpMessageNotReadableException.class})
    ResponseEntity<ApiResponse> handlingBadRequest(Exception exception) {
        return toResponse(ErrorCode.INVALID_KEY, exception.getMessage());
    }

    private ResponseEntity<ApiResponse> toResponse(ErrorCode errorCode, String message) {
        return toResponse(errorCode.getStatusCode(), errorCode.getCode(), message);
    }

    private ResponseEntity<ApiResponse> toResponse(HttpStatusCode status, int code, String message) {
        return ResponseEntity.status(status)
                .body(ApiResponse.builder()
                        .code(code)
                        .message(message)
                        .build());
    }
}
