package io.b2mash.possync.syncjob;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class JobNotCancellableException extends ErrorResponseException {

  public JobNotCancellableException(String jobId, SyncJobStatus status) {
    super(HttpStatus.CONFLICT, createProblem(jobId, status), null);
  }

  private static ProblemDetail createProblem(String jobId, SyncJobStatus status) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Job cannot be cancelled");
    problem.setDetail(
        "Sync job " + jobId + " is " + status + "; only pending jobs can be cancelled");
    return problem;
  }
}
