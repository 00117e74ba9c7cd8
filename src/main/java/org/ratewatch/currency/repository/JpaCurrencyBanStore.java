package org.ratewatch.currency.repository;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import org.ratewatch.currency.domain.CurrencyCode;
import org.ratewatch.currency.exception.BanStoreException;

/**
 * {@link CurrencyBanStore} backed by the {@code currency_bans} table.
 *
 * <p>Each call runs in its own transaction whose timeout is the caller's timeout rounded up to
 * whole seconds.
 */
@Component
public class JpaCurrencyBanStore implements CurrencyBanStore {

  private static final Logger log = LoggerFactory.getLogger(JpaCurrencyBanStore.class);

  private final CurrencyBanRepository currencyBanRepository;
  private final PlatformTransactionManager transactionManager;

  public JpaCurrencyBanStore(
      CurrencyBanRepository currencyBanRepository, PlatformTransactionManager transactionManager) {
    this.currencyBanRepository = currencyBanRepository;
    this.transactionManager = transactionManager;
  }

  @Override
  public Map<CurrencyCode, Boolean> listBans(Set<CurrencyCode> codes, Duration timeout) {
    if (codes.isEmpty()) {
      return Map.of();
    }

    var values = codes.stream().map(CurrencyCode::value).toList();
    try {
      var rows =
          transaction(timeout, true)
              .execute(status -> currencyBanRepository.findByCurrencyIn(values));

      var bans = new HashMap<CurrencyCode, Boolean>();
      if (rows != null) {
        rows.forEach(row -> bans.put(new CurrencyCode(row.getCurrency()), row.isBanned()));
      }
      log.debug("Loaded {} ban rows for {} currencies", bans.size(), codes.size());
      return bans;
    } catch (DataAccessException | TransactionException e) {
      log.warn("Failed to list currency bans: {}", e.getMessage());
      throw new BanStoreException("Failed to list currency bans", e);
    }
  }

  @Override
  public void upsertBan(CurrencyCode code, boolean banned, Duration timeout) {
    try {
      transaction(timeout, false)
          .executeWithoutResult(status -> currencyBanRepository.upsert(code.value(), banned));
      log.info("Stored ban flag currency: {} banned: {}", code, banned);
    } catch (DataAccessException | TransactionException e) {
      log.warn("Failed to store ban flag for {}: {}", code, e.getMessage());
      throw new BanStoreException("Failed to change ban status for " + code, e);
    }
  }

  private TransactionTemplate transaction(Duration timeout, boolean readOnly) {
    var template = new TransactionTemplate(transactionManager);
    template.setTimeout(timeoutSeconds(timeout));
    template.setReadOnly(readOnly);
    return template;
  }

  static int timeoutSeconds(Duration timeout) {
    var millis = Math.max(timeout.toMillis(), 1);
    return (int) Math.min(Integer.MAX_VALUE, (millis + 999) / 1000);
  }
}
