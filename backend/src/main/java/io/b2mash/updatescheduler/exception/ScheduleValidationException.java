package io.b2mash.updatescheduler.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Rejects a cadence/anchor combination or a malformed time before the schedule is stored. Results
 * in HTTP 400; never reaches the execution history.
 */
public class ScheduleValidationException extends ErrorResponseException {

  public ScheduleValidationException(String detail) {
    super(HttpStatus.BAD_REQUEST, createProblem(detail), null);
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Invalid schedule");
    problem.setDetail(detail);
    return problem;
  }
}
