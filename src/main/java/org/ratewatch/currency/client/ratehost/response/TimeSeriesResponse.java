package org.ratewatch.currency.client.ratehost.response;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import org.ratewatch.currency.domain.CalendarDate;
import org.ratewatch.currency.domain.CurrencyCode;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TimeSeriesResponse(
    boolean success,
    CurrencyCode base,
    Map<CalendarDate, Map<CurrencyCode, Double>> rates,
    @JsonProperty("start_date") CalendarDate startDate,
    @JsonProperty("end_date") CalendarDate endDate,
    RateHostError error) {}
