package org.ratewatch.currency.api.error;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import org.ratewatch.currency.exception.BusinessException;
import org.ratewatch.currency.exception.DependencyException;
import org.ratewatch.currency.exception.InvalidRequestException;

/** Maps exceptions raised while serving a request to {@link ApiErrorResponse} bodies. */
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(InvalidRequestException.class)
  @ResponseStatus(HttpStatus.BAD_REQUEST)
  public ApiErrorResponse handleInvalidRequest(InvalidRequestException e) {
    log.info("Invalid request: {}", e.getMessage());
    return ApiErrorResponse.of(ApiErrorType.INVALID_REQUEST, e.getMessage(), e.getCode());
  }

  @ExceptionHandler(MissingServletRequestParameterException.class)
  @ResponseStatus(HttpStatus.BAD_REQUEST)
  public ApiErrorResponse handleMissingParameter(MissingServletRequestParameterException e) {
    log.info("Missing request parameter: {}", e.getParameterName());
    return ApiErrorResponse.of(
        ApiErrorType.INVALID_REQUEST,
        "Missing required parameter: " + e.getParameterName(),
        null);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  @ResponseStatus(HttpStatus.BAD_REQUEST)
  public ApiErrorResponse handleUnreadableBody(HttpMessageNotReadableException e) {
    log.info("Unreadable request body: {}", e.getMessage());
    return ApiErrorResponse.of(ApiErrorType.INVALID_REQUEST, "Malformed request body", null);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  @ResponseStatus(HttpStatus.BAD_REQUEST)
  public ApiErrorResponse handleValidation(MethodArgumentNotValidException e) {
    var fieldErrors =
        e.getBindingResult().getFieldErrors().stream()
            .map(
                error ->
                    new ApiErrorResponse.FieldError(error.getField(), error.getDefaultMessage()))
            .toList();
    log.info("Request validation failed: {}", fieldErrors);
    return new ApiErrorResponse(
        ApiErrorType.VALIDATION_ERROR, "Request validation failed", null, fieldErrors);
  }

  @ExceptionHandler(BusinessException.class)
  @ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
  public ApiErrorResponse handleBusiness(BusinessException e) {
    log.info("Business error: {} {}", e.getCode(), e.getMessage());
    return ApiErrorResponse.of(ApiErrorType.APPLICATION_ERROR, e.getMessage(), e.getCode());
  }

  @ExceptionHandler(DependencyException.class)
  @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
  public ApiErrorResponse handleDependency(DependencyException e) {
    log.error("Dependency failure: {} {}", e.getCode(), e.getMessage(), e);
    return ApiErrorResponse.of(ApiErrorType.DEPENDENCY_ERROR, e.getMessage(), e.getCode());
  }

  @ExceptionHandler(RuntimeException.class)
  @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
  public ApiErrorResponse handleUnexpected(RuntimeException e) {
    log.error("Unexpected error: {}", e.getMessage(), e);
    return ApiErrorResponse.of(ApiErrorType.INTERNAL_ERROR, "Unexpected error", null);
  }
}
