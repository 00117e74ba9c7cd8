package org.ratewatch.currency.api.response;

import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;

import io.swagger.v3.oas.annotations.media.Schema;

import org.ratewatch.currency.domain.CalendarDate;
import org.ratewatch.currency.domain.CurrencyTimelineRate;

@Schema(description = "Daily exchange rates for a currency pair, with predicted rates")
public record CurrencyTimelineResponse(
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
            description = "Rate per date within the requested range, in date order",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "{\"2024-03-01\": 0.9231, \"2024-03-02\": 0.9228}")
        Map<String, Double> rates,
    @Schema(
            description = "Predicted rate per date following the last known rate",
            example = "{\"2024-03-05\": 0.9219}")
        @JsonInclude(JsonInclude.Include.NON_EMPTY)
        Map<String, Double> predictions,
    @Schema(
            description = "Requested start date",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "2024-03-01")
        String startDate,
    @Schema(
            description = "Requested end date",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "2024-03-31")
        String endDate) {

  public static CurrencyTimelineResponse from(CurrencyTimelineRate timeline) {
    return new CurrencyTimelineResponse(
        timeline.base().value(),
        timeline.second().value(),
        byDate(timeline.rates()),
        byDate(timeline.predictions()),
        timeline.startDate().format(),
        timeline.endDate().format());
  }

  private static Map<String, Double> byDate(Map<CalendarDate, Double> values) {
    var result = new LinkedHashMap<String, Double>();
    values.forEach((date, rate) -> result.put(date.format(), rate));
    return result;
  }
}
