package io.b2mash.taskboard.exception;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import com.fasterxml.jackson.databind.exc.ValueInstantiationException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.validation.ObjectError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  static final String NON_FIELD_ERRORS = "non_field_errors";

  private static final PropertyNamingStrategies.SnakeCaseStrategy SNAKE_CASE =
      new PropertyNamingStrategies.SnakeCaseStrategy();

  @Override
  protected ResponseEntity<Object> handleMethodArgumentNotValid(
      MethodArgumentNotValidException ex,
      HttpHeaders headers,
      HttpStatusCode status,
      WebRequest request) {
    Map<String, List<String>> errors = new LinkedHashMap<>();
    for (FieldError fieldError : ex.getBindingResult().getFieldErrors()) {
      errors
          .computeIfAbsent(toJsonPath(fieldError.getField()), k -> new ArrayList<>())
          .add(fieldError.getDefaultMessage());
    }
    for (ObjectError globalError : ex.getBindingResult().getGlobalErrors()) {
      errors
          .computeIfAbsent(NON_FIELD_ERRORS, k -> new ArrayList<>())
          .add(globalError.getDefaultMessage());
    }
    log.debug("Request validation failed: {}", errors);
    return ResponseEntity.badRequest().body(FieldValidationException.createProblem(errors));
  }

  @Override
  protected ResponseEntity<Object> handleHttpMessageNotReadable(
      HttpMessageNotReadableException ex,
      HttpHeaders headers,
      HttpStatusCode status,
      WebRequest request) {
    if (ex.getCause() instanceof JsonMappingException mappingException
        && !mappingException.getPath().isEmpty()) {
      String field = toJsonPath(mappingException.getPath());
      String message = describe(mappingException);
      log.debug("Unreadable value for field {}: {}", field, message);
      return ResponseEntity.badRequest()
          .body(FieldValidationException.createProblem(Map.of(field, List.of(message))));
    }

    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Malformed request");
    problem.setDetail("Request body is missing or is not valid JSON");
    return ResponseEntity.badRequest().body(problem);
  }

  @ExceptionHandler(DataIntegrityViolationException.class)
  public ResponseEntity<ProblemDetail> handleDataIntegrityViolation(
      DataIntegrityViolationException ex) {
    log.warn("Data integrity violation: {}", ex.getMostSpecificCause().getMessage());
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Conflicting data");
    problem.setDetail("The request conflicts with existing data. Please retry.");
    return ResponseEntity.status(HttpStatus.CONFLICT).body(problem);
  }

  private static String describe(JsonMappingException ex) {
    if (ex instanceof ValueInstantiationException && ex.getCause() != null) {
      return ex.getCause().getMessage();
    }
    if (ex instanceof InvalidFormatException invalidFormat) {
      return "Invalid value '" + invalidFormat.getValue() + "'";
    }
    if (ex instanceof MismatchedInputException) {
      return "Invalid type";
    }
    return "Invalid value";
  }

  /** Renders a Jackson reference path, e.g. {@code subtasks[1].title}. */
  static String toJsonPath(List<JsonMappingException.Reference> path) {
    var sb = new StringBuilder();
    for (JsonMappingException.Reference reference : path) {
      if (reference.getFieldName() != null) {
        if (sb.length() > 0) {
          sb.append('.');
        }
        sb.append(reference.getFieldName());
      } else if (reference.getIndex() >= 0) {
        sb.append('[').append(reference.getIndex()).append(']');
      }
    }
    return sb.toString();
  }

  /**
   * Converts a bean property path ({@code subtasks[0].dueDate}) to its snake_case JSON form
   * ({@code subtasks[0].due_date}).
   */
  static String toJsonPath(String propertyPath) {
    var sb = new StringBuilder();
    for (String segment : propertyPath.split("\\.")) {
      if (sb.length() > 0) {
        sb.append('.');
      }
      int bracket = segment.indexOf('[');
      String name = bracket >= 0 ? segment.substring(0, bracket) : segment;
      sb.append(SNAKE_CASE.translate(name));
      if (bracket >= 0) {
        sb.append(segment.substring(bracket));
      }
    }
    return sb.toString();
  }
}
