package com.fundermatch.api;

import com.fundermatch.grants.http.RemoteApiException;
import com.fundermatch.grants.http.RemoteNotFoundException;
import com.fundermatch.grants.persistence.StoreException;
import com.fundermatch.matching.ai.MatchParseException;
import com.fundermatch.matching.service.FunderNotFoundException;
import com.fundermatch.matching.service.NoFundersAvailableException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<Map<String, Object>> handleBadRequest(IllegalArgumentException ex) {
    return body(HttpStatus.BAD_REQUEST, "bad_request", ex.getMessage());
  }

  @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
  public ResponseEntity<Map<String, Object>> handleUnreadable(Exception ex) {
    return body(HttpStatus.BAD_REQUEST, "bad_request", "Malformed request");
  }

  @ExceptionHandler(FunderNotFoundException.class)
  public ResponseEntity<Map<String, Object>> handleFunderNotFound(FunderNotFoundException ex) {
    return body(HttpStatus.NOT_FOUND, "not_found", ex.getMessage());
  }

  @ExceptionHandler(RemoteNotFoundException.class)
  public ResponseEntity<Map<String, Object>> handleRemoteNotFound(RemoteNotFoundException ex) {
    return body(HttpStatus.NOT_FOUND, "not_found", ex.getMessage());
  }

  @ExceptionHandler(RemoteApiException.class)
  public ResponseEntity<Map<String, Object>> handleRemote(RemoteApiException ex) {
    log.warn("Grant-data API failure (status {})", ex.getStatusCode(), ex);
    return body(HttpStatus.BAD_GATEWAY, "remote_api_error", ex.getMessage());
  }

  @ExceptionHandler(NoFundersAvailableException.class)
  public ResponseEntity<Map<String, Object>> handleNoFunders(NoFundersAvailableException ex) {
    return body(HttpStatus.SERVICE_UNAVAILABLE, "no_funders", ex.getMessage());
  }

  @ExceptionHandler(MatchParseException.class)
  public ResponseEntity<Map<String, Object>> handleParse(MatchParseException ex) {
    log.warn("Scoring response rejected: {}", ex.getMessage());
    return body(HttpStatus.BAD_GATEWAY, "parse_error", ex.getMessage());
  }

  @ExceptionHandler({StoreException.class, DataAccessException.class})
  public ResponseEntity<Map<String, Object>> handleStore(RuntimeException ex) {
    log.error("Store failure", ex);
    return body(HttpStatus.INTERNAL_SERVER_ERROR, "store_error", ex.getMessage());
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<Map<String, Object>> handleUnexpected(RuntimeException ex) {
    log.error("Request failed", ex);
    return body(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", ex.getMessage());
  }

  private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String error, String message) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("success", false);
    body.put("error", error);
    body.put("message", message == null ? error : message);
    return ResponseEntity.status(status).body(body);
  }
}
