package org.ratewatch.currency.domain;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * The universe of currency codes this service accepts.
 *
 * <p>A code is valid only if it is a member of the registry. The default registry holds the codes
 * the upstream rate provider publishes rates for.
 */
public final class CurrencyRegistry {

  /** Codes published by the upstream rate provider. */
  static final List<String> SUPPORTED_CODES =
      List.of(
          "AED", "AFN", "ALL", "AMD", "ANG", "AOA", "ARS", "AUD", "AWG", "AZN", "BAM", "BBD", "BDT",
          "BGN", "BHD", "BIF", "BMD", "BND", "BOB", "BRL", "BSD", "BTC", "BTN", "BWP", "BYN", "BZD",
          "CAD", "CDF", "CHF", "CLF", "CLP", "CNH", "CNY", "COP", "CRC", "CUC", "CUP", "CVE", "CZK",
          "DJF", "DKK", "DOP", "DZD", "EGP", "ERN", "ETB", "EUR", "FJD", "FKP", "GBP", "GEL", "GGP",
          "GHS", "GIP", "GMD", "GNF", "GTQ", "GYD", "HKD", "HNL", "HRK", "HTG", "HUF", "IDR", "ILS",
          "IMP", "INR", "IQD", "IRR", "ISK", "JEP", "JMD", "JOD", "JPY", "KES", "KGS", "KHR", "KMF",
          "KPW", "KRW", "KWD", "KYD", "KZT", "LAK", "LBP", "LKR", "LRD", "LSL", "LYD", "MAD", "MDL",
          "MGA", "MKD", "MMK", "MNT", "MOP", "MRU", "MUR", "MVR", "MWK", "MXN", "MYR", "MZN", "NAD",
          "NGN", "NIO", "NOK", "NPR", "NZD", "OMR", "PAB", "PEN", "PGK", "PHP", "PKR", "PLN", "PYG",
          "QAR", "RON", "RSD", "RUB", "RWF", "SAR", "SBD", "SCR", "SDG", "SEK", "SGD", "SHP", "SLL",
          "SOS", "SRD", "SSP", "STD", "STN", "SVC", "SYP", "SZL", "THB", "TJS", "TMT", "TND", "TOP",
          "TRY", "TTD", "TWD", "TZS", "UAH", "UGX", "USD", "UYU", "UZS", "VES", "VND", "VUV", "WST",
          "XAF", "XAG", "XAU", "XCD", "XDR", "XOF", "XPD", "XPF", "XPT", "YER", "ZAR", "ZMW", "ZWL");

  private final Set<CurrencyCode> codes;

  public CurrencyRegistry(Collection<String> codes) {
    var sorted = new TreeSet<CurrencyCode>();
    for (var code : codes) {
      if (code == null || code.isBlank()) {
        throw new IllegalArgumentException("Registry codes must not be blank");
      }
      sorted.add(new CurrencyCode(code));
    }
    this.codes = Collections.unmodifiableSortedSet(sorted);
  }

  public static CurrencyRegistry withSupportedCodes() {
    return new CurrencyRegistry(SUPPORTED_CODES);
  }

  public boolean isValid(String code) {
    return code != null && codes.contains(new CurrencyCode(code));
  }

  public boolean isValid(CurrencyCode code) {
    return code != null && codes.contains(code);
  }

  /** All registry codes in ascending order. */
  public Set<CurrencyCode> allCodes() {
    return codes;
  }
}
