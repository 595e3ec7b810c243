package com.ylm.attendance.payroll.exception;

import com.ylm.attendance.payroll.dto.ApiResponse;
import io.swagger.v3.oas.annotations.Hidden;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    // ====== Empty attendance input ======
    @ExceptionHandler(NoRecordsProvidedException.class)
    public ResponseEntity<ApiResponse<?>> handleNoRecords(NoRecordsProvidedException ex) {
        logger.warn("Calculation rejected: {}", ex.getMessage());
        ApiResponse<?> errorResponse = ApiResponse.error(
                "No Records Provided",
                NoRecordsProvidedException.ERROR_CODE,
                ex.getMessage()
        );
        return new ResponseEntity<>(errorResponse, HttpStatus.BAD_REQUEST);
    }

    // ====== Handle @Valid validation errors ======
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<?>> handleMethodArgumentNotValid(MethodArgumentNotValidException ex) {
        String detail = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining("; "));

        ApiResponse<?> errorResponse = ApiResponse.error(
                "Request validation failed",
                String.valueOf(HttpStatus.BAD_REQUEST.value()),
                detail
        );
        return new ResponseEntity<>(errorResponse, HttpStatus.BAD_REQUEST);
    }

    // ====== Handle JSON parse errors ======
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<?>> handleHttpMessageNotReadable(HttpMessageNotReadableException ex) {
        String detail = ex.getMostSpecificCause() != null
                ? ex.getMostSpecificCause().getMessage()
                : ex.getMessage();

        ApiResponse<?> errorResponse = ApiResponse.error(
                "Malformed JSON request",
                String.valueOf(HttpStatus.BAD_REQUEST.value()),
                detail
        );
        return new ResponseEntity<>(errorResponse, HttpStatus.BAD_REQUEST);
    }

    @Hidden
    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ApiResponse<?>> handleValidationException(ValidationException ex) {
        logger.error("Validation error: {}", ex.getErrors());

        String detail = ex.getErrors().entrySet().stream()
                .map(e -> e.getKey() + ": " + e.getValue())
                .collect(Collectors.joining("; "));

        ApiResponse<?> errorResponse = ApiResponse.error(
                "Validation Error",
                String.valueOf(HttpStatus.BAD_REQUEST.value()),
                detail
        );
        return new ResponseEntity<>(errorResponse, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ApiResponse<?>> handleNotFound(ResourceNotFoundException ex) {
        logger.info("{} not found: {}", ex.getResourceType(), ex.getMessage());
        ApiResponse<?> errorResponse = ApiResponse.error(
                "Salary Report Not Found",
                String.valueOf(HttpStatus.NOT_FOUND.value()),
                ex.getMessage()
        );
        return new ResponseEntity<>(errorResponse, HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(ReportStorageException.class)
    public ResponseEntity<ApiResponse<?>> handleStorage(ReportStorageException ex) {
        logger.error("Report storage failure: ", ex);
        ApiResponse<?> errorResponse = ApiResponse.error(
                "Report Storage Error",
                String.valueOf(HttpStatus.INTERNAL_SERVER_ERROR.value()),
                ex.getMessage()
        );
        return new ResponseEntity<>(errorResponse, HttpStatus.INTERNAL_SERVER_ERROR);
    }

    // ====== Handle ALL other unhandled exceptions ======
    @Hidden
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<?>> handleGeneralException(Exception ex) {
        logger.error("Unhandled exception: ", ex);
        ApiResponse<?> errorResponse = ApiResponse.error(
                "Internal Server Error",
                String.valueOf(HttpStatus.INTERNAL_SERVER_ERROR.value()),
                ex.getMessage() != null ? ex.getMessage() : "An unexpected error occurred"
        );
        return new ResponseEntity<>(errorResponse, HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
