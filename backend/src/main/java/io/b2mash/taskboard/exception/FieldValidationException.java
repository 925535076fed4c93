package io.b2mash.taskboard.exception;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Validation failure detected by a service after bean validation passed (uniqueness, unknown
 * references, mismatched confirmations). The problem body carries an {@code errors} map keyed by
 * the JSON field path, the same shape {@link GlobalExceptionHandler} produces for bean-validation
 * failures.
 */
public class FieldValidationException extends ErrorResponseException {

  public static final String ERRORS_PROPERTY = "errors";

  private final Map<String, List<String>> errors;

  public FieldValidationException(String field, String message) {
    this(Map.of(field, List.of(message)));
  }

  public FieldValidationException(Map<String, List<String>> errors) {
    super(HttpStatus.BAD_REQUEST, createProblem(errors), null);
    this.errors = new LinkedHashMap<>(errors);
  }

  public Map<String, List<String>> getErrors() {
    return errors;
  }

  static ProblemDetail createProblem(Map<String, List<String>> errors) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Validation failed");
    problem.setDetail("One or more fields are invalid");
    problem.setProperty(ERRORS_PROPERTY, new LinkedHashMap<>(errors));
    return problem;
  }
}
