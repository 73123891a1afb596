package io.b2mash.possync.syncjob;

import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** A restaurant already has an active sync job. Carries that job's id. */
public class SyncAlreadyInProgressException extends ErrorResponseException {

  private final String jobId;

  public SyncAlreadyInProgressException(UUID restaurantId, String jobId) {
    super(HttpStatus.CONFLICT, createProblem(restaurantId, jobId), null);
    this.jobId = jobId;
  }

  public String getJobId() {
    return jobId;
  }

  private static ProblemDetail createProblem(UUID restaurantId, String jobId) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Sync already in progress");
    problem.setDetail("Restaurant " + restaurantId + " already has an active sync job " + jobId);
    return problem;
  }
}
