package org.ratewatch.currency.client.ratehost.response;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import org.ratewatch.currency.domain.CalendarDate;
import org.ratewatch.currency.domain.CurrencyCode;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RateSnapshotResponse(
    boolean success,
    CurrencyCode base,
    Map<CurrencyCode, Double> rates,
    CalendarDate date,
    RateHostError error) {}
