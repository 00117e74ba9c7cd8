package org.ratewatch.currency.api;

import java.util.List;

import jakarta.validation.Valid;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.ratewatch.currency.api.error.ApiErrorResponse;
import org.ratewatch.currency.api.request.CurrencyBanRequest;
import org.ratewatch.currency.api.response.CurrencyAvailabilityResponse;
import org.ratewatch.currency.api.response.CurrencyRateResponse;
import org.ratewatch.currency.api.response.CurrencyTimelineResponse;
import org.ratewatch.currency.service.CurrencyRateService;

@Tag(
    name = "Currency Handler",
    description = "Endpoints for currency availability, bans and exchange rates")
@RestController
@RequestMapping(path = "/v1/currency")
public class CurrencyController {

  private static final Logger log = LoggerFactory.getLogger(CurrencyController.class);

  private final CurrencyRateService currencyRateService;

  public CurrencyController(CurrencyRateService currencyRateService) {
    this.currencyRateService = currencyRateService;
  }

  @Operation(
      summary = "List available currencies",
      description =
          "List every supported currency with its ban status, banned currencies first and then"
              + " by currency code")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            content =
                @Content(
                    mediaType = "application/json",
                    array =
                        @ArraySchema(
                            schema =
                                @Schema(implementation = CurrencyAvailabilityResponse.class)))),
        @ApiResponse(
            responseCode = "500",
            description = "Cache or ban store unavailable",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = ApiErrorResponse.class)))
      })
  @GetMapping(path = "/available", produces = "application/json")
  public List<CurrencyAvailabilityResponse> getAvailableCurrencies() {
    log.info("Received getAvailableCurrencies request");

    return currencyRateService.getAvailableCurrencies().stream()
        .map(CurrencyAvailabilityResponse::from)
        .toList();
  }

  @Operation(summary = "Change ban status", description = "Ban or unban a supported currency")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "200", description = "Ban status changed"),
        @ApiResponse(
            responseCode = "400",
            description = "Invalid request",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = ApiErrorResponse.class))),
        @ApiResponse(
            responseCode = "500",
            description = "Ban store unavailable",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = ApiErrorResponse.class)))
      })
  @PostMapping(path = "/change-ban", consumes = "application/json")
  public void changeBanStatus(@Valid @RequestBody CurrencyBanRequest request) {
    log.info(
        "Received changeBanStatus request currency: {} banned: {}",
        request.currency(),
        request.banned());

    currencyRateService.changeBanStatus(request.currency(), request.banned());
  }

  @Operation(
      summary = "Get current rate",
      description = "Get the latest known rate for converting the base currency into the second")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = CurrencyRateResponse.class))),
        @ApiResponse(
            responseCode = "400",
            description = "Unsupported currency code",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = ApiErrorResponse.class))),
        @ApiResponse(
            responseCode = "422",
            description = "Rate not published by the provider",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = ApiErrorResponse.class),
                    examples = {
                      @ExampleObject(
                          name = "Rate Not Found",
                          summary = "The provider returned no rate for the second currency",
                          value =
                              """
                      {
                        "type": "APPLICATION_ERROR",
                        "message": "No rate available for USD/XAG",
                        "code": "RATE_NOT_FOUND"
                      }
                      """)
                    })),
        @ApiResponse(
            responseCode = "500",
            description = "Cache or rate provider unavailable",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = ApiErrorResponse.class)))
      })
  @GetMapping(path = "/current-rate", produces = "application/json")
  public CurrencyRateResponse getCurrentRate(
      @Parameter(description = "Base currency code", example = "USD") @RequestParam String base,
      @Parameter(description = "Target currency code", example = "EUR") @RequestParam
          String second) {
    log.info("Received getCurrentRate request base: {} second: {}", base, second);

    return CurrencyRateResponse.from(currencyRateService.getCurrentRate(base, second));
  }

  @Operation(
      summary = "Get rate time series",
      description =
          "Get daily rates between start and end, both inclusive, together with predicted rates"
              + " for the days after the last known rate")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = CurrencyTimelineResponse.class))),
        @ApiResponse(
            responseCode = "400",
            description = "Unsupported currency code or invalid date range",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = ApiErrorResponse.class),
                    examples = {
                      @ExampleObject(
                          name = "Invalid Date",
                          summary = "A date is not in YYYY-MM-DD format",
                          value =
                              """
                      {
                        "type": "INVALID_REQUEST",
                        "message": "Invalid start date, expected YYYY-MM-DD: 01.03.2024",
                        "code": "INVALID_DATE"
                      }
                      """),
                      @ExampleObject(
                          name = "Invalid Date Range",
                          summary = "Start date is after end date",
                          value =
                              """
                      {
                        "type": "INVALID_REQUEST",
                        "message": "Start date 2024-03-31 is after end date 2024-03-01",
                        "code": "INVALID_DATE_RANGE"
                      }
                      """)
                    })),
        @ApiResponse(
            responseCode = "422",
            description = "Rate not published by the provider",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = ApiErrorResponse.class))),
        @ApiResponse(
            responseCode = "500",
            description = "Cache, rate provider or forecast service unavailable",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = ApiErrorResponse.class)))
      })
  @GetMapping(path = "/time-series", produces = "application/json")
  public CurrencyTimelineResponse getTimelineRate(
      @Parameter(description = "Base currency code", example = "USD") @RequestParam String base,
      @Parameter(description = "Target currency code", example = "EUR") @RequestParam
          String second,
      @Parameter(description = "First date of the range in ISO format", example = "2024-03-01")
          @RequestParam
          String start,
      @Parameter(description = "Last date of the range in ISO format", example = "2024-03-31")
          @RequestParam
          String end) {
    log.info(
        "Received getTimelineRate request base: {} second: {} start: {} end: {}",
        base,
        second,
        start,
        end);

    return CurrencyTimelineResponse.from(
        currencyRateService.getTimelineRate(base, second, start, end));
  }
}
