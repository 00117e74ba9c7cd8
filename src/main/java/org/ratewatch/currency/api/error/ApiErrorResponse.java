package org.ratewatch.currency.api.error;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

import io.swagger.v3.oas.annotations.media.Schema;

/** Error body returned by every endpoint. */
@Schema(description = "Error response")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiErrorResponse(
    @Schema(
            description = "Error category",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "INVALID_REQUEST")
        ApiErrorType type,
    @Schema(
            description = "Human readable description",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "Unsupported currency code for base: XXX")
        String message,
    @Schema(description = "Machine readable error code", example = "INVALID_CURRENCY_CODE")
        String code,
    @Schema(description = "Field level validation failures") List<FieldError> fieldErrors) {

  public static ApiErrorResponse of(ApiErrorType type, String message, String code) {
    return new ApiErrorResponse(type, message, code, null);
  }

  public record FieldError(String field, String message) {}
}
