package org.ratewatch.currency.api.response;

import io.swagger.v3.oas.annotations.media.Schema;

import org.ratewatch.currency.domain.CurrencyWithBanStatus;

@Schema(description = "Supported currency with its ban status")
public record CurrencyAvailabilityResponse(
    @Schema(
            description = "Currency code",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "EUR")
        String currency,
    @Schema(
            description = "Whether the currency is banned",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "false")
        boolean banned) {

  public static CurrencyAvailabilityResponse from(CurrencyWithBanStatus status) {
    return new CurrencyAvailabilityResponse(status.currency().value(), status.banned());
  }
}
