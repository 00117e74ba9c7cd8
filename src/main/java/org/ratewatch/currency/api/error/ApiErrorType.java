package org.ratewatch.currency.api.error;

/** Category of an API error, reported as the {@code type} of {@link ApiErrorResponse}. */
public enum ApiErrorType {
  /** Malformed or unsupported request parameters. */
  INVALID_REQUEST,

  /** Request body failed bean validation. */
  VALIDATION_ERROR,

  /** Well-formed request that cannot be satisfied. */
  APPLICATION_ERROR,

  /** Cache, ban store or an upstream service failed. */
  DEPENDENCY_ERROR,

  INTERNAL_ERROR,
}
