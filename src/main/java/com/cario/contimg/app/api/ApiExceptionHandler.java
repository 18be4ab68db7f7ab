package com.cario.contimg.app.api;

import com.cario.contimg.app.error.ErrorKind;
import com.cario.contimg.app.error.PipelineException;
import jakarta.validation.ConstraintViolationException;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.log4j.Log4j2;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Maps {@link ErrorKind} to HTTP status codes with a small JSON body. */
@Log4j2
@RestControllerAdvice
public class ApiExceptionHandler {

  @ExceptionHandler(PipelineException.class)
  public ResponseEntity<Map<String, Object>> handlePipeline(PipelineException e) {
    HttpStatus status = statusFor(e.getKind());
    if (status.is5xxServerError()) {
      log.error("api.error kind={} msg={}", e.getKind(), e.getMessage());
    } else {
      log.info("api.rejected kind={} msg={}", e.getKind(), e.getMessage());
    }
    return body(status, e.getKind().name(), e.getMessage());
  }

  @ExceptionHandler({
    IllegalArgumentException.class,
    ConstraintViolationException.class,
    MethodArgumentNotValidException.class
  })
  public ResponseEntity<Map<String, Object>> handleBadRequest(Exception e) {
    log.info("api.bad-request msg={}", e.getMessage());
    return body(HttpStatus.BAD_REQUEST, "BAD_REQUEST", e.getMessage());
  }

  static HttpStatus statusFor(ErrorKind kind) {
    switch (kind) {
      case NOT_FOUND:
        return HttpStatus.NOT_FOUND;
      case DUPLICATE_UNIT:
      case DUPLICATE_DATA_ID:
      case PARTIAL_CLAIM:
      case INVALID_TRANSITION:
        return HttpStatus.CONFLICT;
      case PATH_VALIDATION:
        return HttpStatus.UNPROCESSABLE_ENTITY;
      case WORKER_UNAVAILABLE:
        return HttpStatus.SERVICE_UNAVAILABLE;
      case TIMEOUT_EXCEEDED:
        return HttpStatus.GATEWAY_TIMEOUT;
      case TOOL_FAILURE:
        return HttpStatus.BAD_GATEWAY;
      case STORAGE_FAILURE:
      default:
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }
  }

  private static ResponseEntity<Map<String, Object>> body(
      HttpStatus status, String kind, String message) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("status", status.value());
    body.put("kind", kind);
    body.put("message", message);
    return ResponseEntity.status(status).body(body);
  }
}
