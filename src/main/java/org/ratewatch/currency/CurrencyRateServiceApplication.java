package org.ratewatch.currency;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CurrencyRateServiceApplication {

  public static void main(String[] args) {
    SpringApplication.run(CurrencyRateServiceApplication.class, args);
  }
}
