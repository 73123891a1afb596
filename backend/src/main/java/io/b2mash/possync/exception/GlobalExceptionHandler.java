package io.b2mash.possync.exception;

import io.b2mash.possync.credential.MissingCredentialFieldsException;
import io.b2mash.possync.pos.TransientNetworkException;
import io.b2mash.possync.pos.UpstreamAuthException;
import io.b2mash.possync.syncjob.SyncAlreadyInProgressException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(SyncAlreadyInProgressException.class)
  public ResponseEntity<Map<String, Object>> handleSyncAlreadyInProgress(
      SyncAlreadyInProgressException ex) {
    log.info("Sync request rejected: {}", ex.getBody().getDetail());
    var body = problemBody(ex.getBody(), HttpStatus.CONFLICT);
    body.put("jobId", ex.getJobId());
    return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
  }

  @ExceptionHandler(MissingCredentialFieldsException.class)
  public ResponseEntity<Map<String, Object>> handleMissingCredentialFields(
      MissingCredentialFieldsException ex) {
    log.warn("POS credentials incomplete: missing={}", ex.getMissingFields());
    var body = problemBody(ex.getBody(), HttpStatus.BAD_REQUEST);
    body.put("missingFields", ex.getMissingFields());
    body.put("presentFields", ex.getPresentFields());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
  }

  @ExceptionHandler(UpstreamAuthException.class)
  public ResponseEntity<ProblemDetail> handleUpstreamAuth(UpstreamAuthException ex) {
    log.warn("POS provider rejected credentials: {}", ex.getMessage());
    var problem = ProblemDetail.forStatus(HttpStatus.UNPROCESSABLE_ENTITY);
    problem.setTitle("POS credentials rejected");
    problem.setDetail(ex.getMessage());
    return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(problem);
  }

  @ExceptionHandler(TransientNetworkException.class)
  public ResponseEntity<ProblemDetail> handleTransientNetwork(TransientNetworkException ex) {
    log.warn("POS provider unavailable: {}", ex.getMessage());
    var problem = ProblemDetail.forStatus(HttpStatus.SERVICE_UNAVAILABLE);
    problem.setTitle("POS provider unavailable");
    problem.setDetail("The POS provider could not be reached. Please retry later.");
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(problem);
  }

  @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
  public ResponseEntity<ProblemDetail> handleOptimisticLock(
      ObjectOptimisticLockingFailureException ex) {
    log.warn("Optimistic locking failure: {}", ex.getMessage());
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Concurrent modification");
    problem.setDetail("Resource was modified concurrently. Please retry.");
    return ResponseEntity.status(HttpStatus.CONFLICT).body(problem);
  }

  @ExceptionHandler(DataAccessException.class)
  public ResponseEntity<ProblemDetail> handleDataAccess(DataAccessException ex) {
    log.error("Storage failure while handling request", ex);
    var problem = ProblemDetail.forStatus(HttpStatus.SERVICE_UNAVAILABLE);
    problem.setTitle("Storage unavailable");
    problem.setDetail("The request could not be completed. Please retry.");
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(problem);
  }

  private static LinkedHashMap<String, Object> problemBody(
      ProblemDetail problem, HttpStatus status) {
    var body = new LinkedHashMap<String, Object>();
    body.put("type", "about:blank");
    body.put("title", problem.getTitle());
    body.put("status", status.value());
    body.put("detail", problem.getDetail());
    return body;
  }
}
