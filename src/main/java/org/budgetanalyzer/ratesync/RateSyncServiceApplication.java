package org.budgetanalyzer.ratesync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RateSyncServiceApplication {

  public static void main(String[] args) {
    SpringApplication.run(RateSyncServiceApplication.class, args);
  }
}
