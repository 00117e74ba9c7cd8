package org.ratewatch.currency.repository;

import java.util.Collection;
import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import org.ratewatch.currency.domain.CurrencyBan;

/** Repository for currency ban overrides. */
public interface CurrencyBanRepository extends JpaRepository<CurrencyBan, Integer> {

  /**
   * Find the ban rows for the given currency codes. Codes without a row are simply absent from the
   * result.
   *
   * @param currencies currency codes to look up
   * @return rows present for the given codes
   */
  List<CurrencyBan> findByCurrencyIn(Collection<String> currencies);

  /**
   * Insert a ban row or update the flag of the existing one. Repeating the call with the same
   * arguments leaves the table unchanged.
   *
   * @param currency currency code
   * @param banned new ban flag
   * @return number of rows written
   */
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      value =
          "INSERT INTO currency_bans (currency, banned) VALUES (:currency, :banned) "
              + "ON CONFLICT (currency) DO UPDATE SET banned = EXCLUDED.banned",
      nativeQuery = true)
  int upsert(@Param("currency") String currency, @Param("banned") boolean banned);
}
