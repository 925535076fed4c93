package io.b2mash.taskboard.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Thrown when login credentials do not match. Never says which credential was wrong. */
public class AuthenticationFailedException extends ErrorResponseException {

  public AuthenticationFailedException() {
    super(HttpStatus.UNAUTHORIZED, createProblem(), null);
  }

  private static ProblemDetail createProblem() {
    var problem = ProblemDetail.forStatus(HttpStatus.UNAUTHORIZED);
    problem.setTitle("Authentication failed");
    problem.setDetail("Invalid credentials");
    return problem;
  }
}
