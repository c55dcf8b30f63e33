package com.dnobretech.bigdumpbackend.exception;

import jakarta.persistence.EntityNotFoundException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.BindException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

import java.time.Instant;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    // 404
    @ExceptionHandler({EntityNotFoundException.class, DumpFileNotFoundException.class})
    public ResponseEntity<ApiError> handleNotFound(RuntimeException ex, HttpServletRequest req) {
        return error(HttpStatus.NOT_FOUND, ex.getMessage(), req);
    }

    // 400 - argumentos inválidos em geral (nome de arquivo, extensão, perfil)
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleBadRequest(IllegalArgumentException ex, HttpServletRequest req) {
        return error(HttpStatus.BAD_REQUEST, ex.getMessage(), req);
    }

    // 409 - import já em andamento, sessão em estado que não permite a ação, upload já existente
    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ApiError> handleConflict(IllegalStateException ex, HttpServletRequest req) {
        return error(HttpStatus.CONFLICT, ex.getMessage(), req);
    }

    // 422 - dump ilegível: codec indisponível, stream corrompido, seek impossível
    @ExceptionHandler({UnsupportedCodecException.class, DumpReadException.class})
    public ResponseEntity<ApiError> handleUnreadable(DumpImportException ex, HttpServletRequest req) {
        log.warn("Dump ilegível: {}", ex.getMessage());
        return error(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage(), req);
    }

    // 400 - demais falhas do import (saída já existe, parsing)
    @ExceptionHandler(DumpImportException.class)
    public ResponseEntity<ApiError> handleImport(DumpImportException ex, HttpServletRequest req) {
        return error(HttpStatus.BAD_REQUEST, ex.getMessage(), req);
    }

    // 413
    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ApiError> handleTooLarge(MaxUploadSizeExceededException ex, HttpServletRequest req) {
        return error(HttpStatus.PAYLOAD_TOO_LARGE, ex.getMessage(), req);
    }

    // 400 - validação do corpo com @Valid (@RequestBody)
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ValidationError> handleBodyValidation(MethodArgumentNotValidException ex, HttpServletRequest req) {
        var errs = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> new FieldErr(fe.getField(), fe.getDefaultMessage()))
                .toList();
        return ResponseEntity.badRequest().body(
                new ValidationError(400, "Bad Request", errs, req.getRequestURI(), Instant.now())
        );
    }

    // 400 - validação de params/query/path (@Validated) e binding de objetos simples
    @ExceptionHandler(BindException.class)
    public ResponseEntity<ValidationError> handleBindValidation(BindException ex, HttpServletRequest req) {
        var errs = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> new FieldErr(fe.getField(), fe.getDefaultMessage()))
                .toList();
        return ResponseEntity.badRequest().body(
                new ValidationError(400, "Bad Request", errs, req.getRequestURI(), Instant.now())
        );
    }

    // 400 - violações programáticas (ex.: @NotBlank em params)
    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiError> handleConstraintViolation(ConstraintViolationException ex, HttpServletRequest req) {
        return error(HttpStatus.BAD_REQUEST, ex.getMessage(), req);
    }

    // 500 - fallback único
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest req) {
        log.error("Erro não tratado", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage(), req);
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, String message, HttpServletRequest req) {
        return ResponseEntity.status(status).body(
                new ApiError(status.value(), status.getReasonPhrase(), message, req.getRequestURI(), Instant.now())
        );
    }
}
