package com.work.bond.demo.web;

import com.work.bond.core.exception.BondErrorCode;
import com.work.bond.core.exception.BondException;
import com.work.bond.demo.web.dto.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

/**
 * 把核心组件的错误码映射为 HTTP 状态码，响应体统一为 {code, reason, category, message}。
 */
@RestControllerAdvice
public class BondExceptionHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(BondExceptionHandler.class);

    @ExceptionHandler(BondException.class)
    public ResponseEntity<ErrorResponse> handleBond(BondException ex) {
        HttpStatus status = statusOf(ex.getCategory());
        LOGGER.warn("[web] request rejected, code={}, status={}, message={}", ex.getCode(), status.value(), ex.getMessage());
        return ResponseEntity.status(status)
                .body(body(ex.getCode().name(), ex.getReason(), ex.getCategory().name(), ex.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining("; "));
        return ResponseEntity.badRequest()
                .body(body("INVALID_ARGUMENT", "invalid argument", BondErrorCode.Category.CONFIGURATION.name(), message));
    }

    @ExceptionHandler({IllegalArgumentException.class, MissingRequestHeaderException.class})
    public ResponseEntity<ErrorResponse> handleIllegalArgument(Exception ex) {
        return ResponseEntity.badRequest()
                .body(body("INVALID_ARGUMENT", "invalid argument", BondErrorCode.Category.CONFIGURATION.name(), ex.getMessage()));
    }

    static HttpStatus statusOf(BondErrorCode.Category category) {
        switch (category) {
            case AUTHORIZATION:
                return HttpStatus.FORBIDDEN;
            case NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case TEMPORAL:
            case CAPACITY:
            case STATE:
                return HttpStatus.CONFLICT;
            case CONFIGURATION:
            case LEDGER:
            default:
                return HttpStatus.BAD_REQUEST;
        }
    }

    private static ErrorResponse body(String code, String reason, String category, String message) {
        ErrorResponse response = new ErrorResponse();
        response.setCode(code);
        response.setReason(reason);
        response.setCategory(category);
        response.setMessage(message);
        return response;
    }
}
