package org.ratewatch.currency.api.response;

import io.swagger.v3.oas.annotations.media.Schema;

import org.ratewatch.currency.domain.CurrencyRate;

@Schema(description = "Latest known exchange rate for a currency pair")
public record CurrencyRateResponse(
    @Schema(
            description = "Base currency code",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "USD")
        String base,
    @Schema(
            description = "Target currency code",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "EUR")
        String second,
    @Schema(
            description = "Units of the target currency for one unit of the base currency",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "0.9214")
        double rate,
    @Schema(description = "Date the rate applies to", example = "2024-03-04", nullable = true)
        String date) {

  public static CurrencyRateResponse from(CurrencyRate rate) {
    return new CurrencyRateResponse(
        rate.base().value(),
        rate.second().value(),
        rate.rate(),
        rate.date().isSet() ? rate.date().format() : null);
  }
}
