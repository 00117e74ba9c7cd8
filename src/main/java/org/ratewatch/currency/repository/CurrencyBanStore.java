package org.ratewatch.currency.repository;

import java.time.Duration;
import java.util.Map;
import java.util.Set;

import org.ratewatch.currency.domain.CurrencyCode;
import org.ratewatch.currency.exception.BanStoreException;

/**
 * Durable ban overrides. The store only knows the rows it holds; it has no notion of which
 * currencies exist.
 *
 * <p>Every call is bounded by the given timeout and reports failures as {@link BanStoreException}.
 */
public interface CurrencyBanStore {

  /**
   * Reads the ban flags stored for {@code codes}.
   *
   * @return flag per code that has a stored row; codes without a row are absent
   */
  Map<CurrencyCode, Boolean> listBans(Set<CurrencyCode> codes, Duration timeout);

  /** Sets the ban flag for {@code code}, creating its row if needed. Idempotent. */
  void upsertBan(CurrencyCode code, boolean banned, Duration timeout);
}
