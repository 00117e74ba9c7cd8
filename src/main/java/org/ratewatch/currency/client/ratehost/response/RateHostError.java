package org.ratewatch.currency.client.ratehost.response;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** Error object the rate host embeds in failed responses. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RateHostError(Integer code, String type, String info) {}
