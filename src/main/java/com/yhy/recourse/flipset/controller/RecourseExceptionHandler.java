package com.yhy.recourse.flipset.controller;

import com.yhy.recourse.flipset.vo.R;
import com.yhy.recourse.mip.exception.CurveValidationException;
import com.yhy.recourse.mip.exception.MipSolverException;
import com.yhy.recourse.mip.exception.RecourseConfigurationException;
import com.yhy.recourse.mip.exception.UnsupportedBackendOperationException;
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
public class RecourseExceptionHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(RecourseExceptionHandler.class);

    @ExceptionHandler({RecourseConfigurationException.class, CurveValidationException.class,
            HttpMessageNotReadableException.class, IllegalArgumentException.class})
    public ResponseEntity<R<Void>> handleBadRequest(Exception e) {
        LOGGER.warn("400 Bad Request: {}", e.getMessage());
        return build(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<R<Void>> handleInvalid(MethodArgumentNotValidException e) {
        String msg = e.getBindingResult().getFieldErrors().stream()
                .map(err -> err.getField() + " " + err.getDefaultMessage())
                .collect(Collectors.joining("; "));
        LOGGER.warn("400 Bad Request: {}", msg);
        return build(HttpStatus.BAD_REQUEST, msg);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<R<Void>> handleConflict(IllegalStateException e) {
        LOGGER.warn("409 Conflict: {}", e.getMessage());
        return build(HttpStatus.CONFLICT, e.getMessage());
    }

    @ExceptionHandler(UnsupportedBackendOperationException.class)
    public ResponseEntity<R<Void>> handleUnsupported(UnsupportedBackendOperationException e) {
        LOGGER.warn("422 Unsupported: {}", e.getMessage());
        return build(HttpStatus.UNPROCESSABLE_ENTITY, e.getMessage());
    }

    @ExceptionHandler(MipSolverException.class)
    public ResponseEntity<R<Void>> handleSolver(MipSolverException e) {
        LOGGER.error("Solver failure: {}", e.getMessage(), e);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
    }

    private static ResponseEntity<R<Void>> build(HttpStatus status, String msg) {
        return ResponseEntity.status(status).body(R.failed(status, msg));
    }
}
