package com.example.retrain;

import com.example.retrain.engine.RetrainInProgressException;
import com.example.retrain.engine.TooSoonException;
import com.example.retrain.job.JobLaunchException;
import com.example.retrain.store.StoreUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;

import java.util.Map;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String,Object>> badRequest(IllegalArgumentException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Map.of("error", ex.getMessage()));
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<Map<String,Object>> invalidBody(WebExchangeBindException ex) {
        String detail = ex.getFieldErrors().stream()
                .map(fe -> fe.getField() + " " + fe.getDefaultMessage())
                .findFirst()
                .orElse("invalid request body");
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Map.of("error", detail));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<Map<String,Object>> framework(ResponseStatusException ex) {
        String reason = ex.getReason() != null ? ex.getReason() : ex.getStatusCode().toString();
        return ResponseEntity.status(ex.getStatusCode())
                .body(Map.of("error", reason));
    }

    @ExceptionHandler(TooSoonException.class)
    public ResponseEntity<Map<String,Object>> tooSoon(TooSoonException ex) {
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .body(Map.of("error", ex.getMessage()));
    }

    @ExceptionHandler(RetrainInProgressException.class)
    public ResponseEntity<Map<String,Object>> inProgress(RetrainInProgressException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(Map.of("error", ex.getMessage()));
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<Map<String,Object>> storeUnavailable(StoreUnavailableException ex) {
        log.error("Retrain state store unavailable", ex);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(Map.of("error", "Retrain state unavailable"));
    }

    @ExceptionHandler(JobLaunchException.class)
    public ResponseEntity<Map<String,Object>> jobLaunch(JobLaunchException ex) {
        log.error("Training job could not be launched", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("error", ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String,Object>> internal(Exception ex) {
        // details stay in the log
        log.error("Unhandled error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("error", "Unable to process retrain request"));
    }
}
