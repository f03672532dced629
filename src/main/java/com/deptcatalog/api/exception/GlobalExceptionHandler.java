package com.deptcatalog.api.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(DepartmentValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidationException(DepartmentValidationException e) {
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(body(e.getErrorCode().name(), e.getMessage(), e.getViolations()));
    }

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<Map<String, Object>> handleBusinessException(BusinessException e) {
        if (e.getType() == ErrorType.PERSISTENCE_FAILURE) {
            log.error("부서 저장소 처리 실패", e);
        }
        return ResponseEntity
                .status(toStatus(e.getType()))
                .body(body(e.getErrorCode().name(), e.getMessage(), null));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleMethodArgumentNotValid(MethodArgumentNotValidException e) {
        List<String> violations = e.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .toList();
        String message = violations.isEmpty() ? ErrorCode.INVALID_REQUEST.getMessage() : violations.get(0);
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(body(ErrorCode.INVALID_REQUEST.name(), message, violations));
    }

    @ExceptionHandler({
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class
    })
    public ResponseEntity<Map<String, Object>> handleBadParameter(Exception e) {
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(body(ErrorCode.INVALID_REQUEST.name(), ErrorCode.INVALID_REQUEST.getMessage(), null));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleException(Exception e) {
        log.error("처리되지 않은 예외 발생", e);
        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(body("INTERNAL_ERROR", "요청을 처리하는 중 오류가 발생했습니다.", null));
    }

    private HttpStatus toStatus(ErrorType type) {
        return switch (type) {
            case INVALID_INPUT -> HttpStatus.BAD_REQUEST;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case CONFLICT -> HttpStatus.CONFLICT;
            case PERSISTENCE_FAILURE -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    private Map<String, Object> body(String error, String message, List<String> violations) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("message", message);
        if (violations != null) {
            body.put("violations", violations);
        }
        return body;
    }
}
