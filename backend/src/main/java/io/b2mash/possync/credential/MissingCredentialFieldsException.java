package io.b2mash.possync.credential;

import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** The restaurant's POS connection is only partially configured. */
public class MissingCredentialFieldsException extends ErrorResponseException {

  private final List<String> missingFields;
  private final List<String> presentFields;

  public MissingCredentialFieldsException(List<String> missingFields, List<String> presentFields) {
    super(HttpStatus.BAD_REQUEST, createProblem(missingFields, presentFields), null);
    this.missingFields = List.copyOf(missingFields);
    this.presentFields = List.copyOf(presentFields);
  }

  public List<String> getMissingFields() {
    return missingFields;
  }

  public List<String> getPresentFields() {
    return presentFields;
  }

  private static ProblemDetail createProblem(List<String> missing, List<String> present) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("POS credentials incomplete");
    problem.setDetail(
        "Missing required encrypted credentials: "
            + String.join(", ", missing)
            + ". Available fields: "
            + (present.isEmpty() ? "none" : String.join(", ", present))
            + ". Reconnect the POS integration.");
    return problem;
  }
}
