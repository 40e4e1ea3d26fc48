package com.example.shifthybrid.exception;

import com.example.shifthybrid.schedule.DateCell;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(MethodArgumentNotValidException ex) {
        Map<String, String> errors = new LinkedHashMap<>();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String fieldName = error instanceof FieldError fieldError ? fieldError.getField() : error.getObjectName();
            errors.put(fieldName, error.getDefaultMessage());
        });
        logger.warn("バリデーションエラーが発生しました: {}", errors);
        return ResponseEntity.badRequest().body(new ErrorResponse(
                "VALIDATION_ERROR", "入力値が不正です", null, List.of(), errors, LocalDateTime.now()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        logger.warn("リクエストボディを読み取れません: {}", ex.getMostSpecificCause().getMessage());
        return ResponseEntity.badRequest().body(new ErrorResponse(
                "MALFORMED_REQUEST", ex.getMostSpecificCause().getMessage(), null, List.of(), null, LocalDateTime.now()));
    }

    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<ErrorResponse> handleConfiguration(ConfigurationException ex) {
        logger.warn("制約設定エラーが発生しました ({}): {}", ex.getConstraintId(), ex.getMessage());
        return ResponseEntity.badRequest().body(ErrorResponse.of(ex));
    }

    @ExceptionHandler(GenerationCancelledException.class)
    public ResponseEntity<ErrorResponse> handleCancelled(GenerationCancelledException ex) {
        logger.info("シフト生成がキャンセルされました: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ErrorResponse.of(ex));
    }

    @ExceptionHandler(ScheduleGenerationException.class)
    public ResponseEntity<ErrorResponse> handleGenerationFailure(ScheduleGenerationException ex) {
        logger.error("シフト生成でエラーが発生しました [{}] constraint={} cells={}: {}", ex.getErrorCode(),
                ex.getConstraintId(), ex.getAffectedCells(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorResponse.of(ex));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        logger.error("予期しないエラーが発生しました", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(new ErrorResponse(
                "INTERNAL_ERROR", "予期しないエラーが発生しました", null, List.of(), null, LocalDateTime.now()));
    }

    public record ErrorResponse(
            String error,
            String message,
            String constraintId,
            List<DateCell> affectedCells,
            Map<String, String> details,
            LocalDateTime timestamp
    ) {
        static ErrorResponse of(ScheduleGenerationException ex) {
            return new ErrorResponse(ex.getErrorCode(), ex.getMessage(), ex.getConstraintId(),
                    ex.getAffectedCells(), null, LocalDateTime.now());
        }
    }
}
