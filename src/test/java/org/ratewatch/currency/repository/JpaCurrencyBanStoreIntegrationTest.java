package org.ratewatch.currency.repository;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import org.ratewatch.currency.base.AbstractIntegrationTest;
import org.ratewatch.currency.fixture.TestConstants;

/** Integration tests for {@link JpaCurrencyBanStore} against a real PostgreSQL. */
class JpaCurrencyBanStoreIntegrationTest extends AbstractIntegrationTest {

  private static final Duration TIMEOUT = Duration.ofSeconds(5);

  @Autowired private CurrencyBanStore currencyBanStore;

  @Test
  void shouldInsertBanOnFirstUpsert() {
    currencyBanStore.upsertBan(TestConstants.RUB, true, TIMEOUT);

    assertThat(testDatabaseHelper.findBan(TestConstants.CURRENCY_RUB)).isTrue();
    assertThat(testDatabaseHelper.countBans()).isEqualTo(1L);
  }

  @Test
  void shouldUpdateExistingRowOnRepeatedUpsert() {
    currencyBanStore.upsertBan(TestConstants.RUB, true, TIMEOUT);
    currencyBanStore.upsertBan(TestConstants.RUB, false, TIMEOUT);

    assertThat(testDatabaseHelper.findBan(TestConstants.CURRENCY_RUB)).isFalse();
    assertThat(testDatabaseHelper.countBans()).isEqualTo(1L);
  }

  @Test
  void shouldListOnlyRequestedCurrenciesWithRows() {
    testDatabaseHelper.insertBan(TestConstants.CURRENCY_RUB, true);
    testDatabaseHelper.insertBan(TestConstants.CURRENCY_EUR, false);
    testDatabaseHelper.insertBan(TestConstants.CURRENCY_GBP, true);

    var bans =
        currencyBanStore.listBans(
            Set.of(TestConstants.RUB, TestConstants.EUR, TestConstants.USD), TIMEOUT);

    assertThat(bans)
        .hasSize(2)
        .containsEntry(TestConstants.RUB, true)
        .containsEntry(TestConstants.EUR, false)
        .doesNotContainKey(TestConstants.USD);
  }

  @Test
  void shouldReturnEmptyMapForNoCurrencies() {
    testDatabaseHelper.insertBan(TestConstants.CURRENCY_RUB, true);

    assertThat(currencyBanStore.listBans(Set.of(), TIMEOUT)).isEmpty();
  }

  @Test
  void shouldRoundSubSecondTimeoutUp() {
    currencyBanStore.upsertBan(TestConstants.EUR, true, Duration.ofMillis(100));

    assertThat(testDatabaseHelper.findBan(TestConstants.CURRENCY_EUR)).isTrue();
  }
}
