package io.b2mash.possync.restaurant;

import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class RestaurantInactiveException extends ErrorResponseException {

  public RestaurantInactiveException(UUID restaurantId) {
    super(HttpStatus.BAD_REQUEST, createProblem(restaurantId), null);
  }

  private static ProblemDetail createProblem(UUID restaurantId) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Restaurant inactive");
    problem.setDetail("Restaurant " + restaurantId + " is inactive; POS sync is disabled");
    return problem;
  }
}
