package com.example.allocation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Payment allocation and ledger posting service. */
@SpringBootApplication
public class LedgerAllocationApplication {

  public static void main(String[] args) {
    SpringApplication.run(LedgerAllocationApplication.class, args);
  }
}
