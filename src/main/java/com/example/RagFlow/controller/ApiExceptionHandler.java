package com.example.RagFlow.controller;

import com.example.RagFlow.exception.CycleDetectedException;
import com.example.RagFlow.exception.ErrorKind;
import com.example.RagFlow.exception.WorkflowException;
import com.example.RagFlow.exception.WorkflowValidationException;
import com.example.RagFlow.model.ApiError;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(WorkflowException.class)
    public ResponseEntity<ApiError> handleWorkflowException(WorkflowException ex, HttpServletRequest request) {
        HttpStatus status = statusFor(ex.getKind());
        Object details = null;
        if (ex instanceof WorkflowValidationException validation) {
            details = validation.getErrors();
        } else if (ex instanceof CycleDetectedException cycle) {
            details = cycle.getUnresolvedIds();
        }

        if (status.is5xxServerError()) {
            log.error("HTTP_ERROR path={}, method={}, kind={}, message={}",
                    resolvePath(request), resolveMethod(request), ex.getKind(), ex.getMessage(), ex);
        } else {
            log.warn("HTTP_ERROR path={}, method={}, kind={}, message={}",
                    resolvePath(request), resolveMethod(request), ex.getKind(), ex.getMessage());
        }
        return ResponseEntity.status(status).body(new ApiError(ex.getKind().name(), ex.getMessage(), details));
    }

    @ExceptionHandler({
            IllegalArgumentException.class,
            HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class,
            MaxUploadSizeExceededException.class
    })
    public ResponseEntity<ApiError> handleBadRequest(Exception ex, HttpServletRequest request) {
        log.warn("HTTP_ERROR path={}, method={}, errorType={}, message={}",
                resolvePath(request), resolveMethod(request), ex.getClass().getSimpleName(), ex.getMessage());
        return ResponseEntity.badRequest().body(new ApiError("BAD_REQUEST", ex.getMessage(), null));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleUnknown(Exception ex, HttpServletRequest request) {
        log.error("HTTP_ERROR path={}, method={}, errorType={}, message={}",
                resolvePath(request), resolveMethod(request), ex.getClass().getSimpleName(), ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ApiError("INTERNAL_ERROR", "Internal server error", null));
    }

    static HttpStatus statusFor(ErrorKind kind) {
        if (kind == null) {
            return HttpStatus.INTERNAL_SERVER_ERROR;
        }
        return switch (kind) {
            case VALIDATION, CYCLE_DETECTED -> HttpStatus.BAD_REQUEST;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case SESSION_BUSY -> HttpStatus.CONFLICT;
            case UPSTREAM_FAILURE -> HttpStatus.BAD_GATEWAY;
            case TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
        };
    }

    private String resolvePath(HttpServletRequest request) {
        return request == null || request.getRequestURI() == null ? "-" : request.getRequestURI();
    }

    private String resolveMethod(HttpServletRequest request) {
        return request == null || request.getMethod() == null ? "-" : request.getMethod();
    }
}
