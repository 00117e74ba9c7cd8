package org.ratewatch.currency.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Request to ban or unban a currency")
public record CurrencyBanRequest(
    @Schema(
            description = "Currency code",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "RUB")
        @NotBlank
        String currency,
    @Schema(
            description = "Whether the currency is banned",
            requiredMode = Schema.RequiredMode.REQUIRED,
            example = "true")
        @NotNull
        Boolean banned) {}
