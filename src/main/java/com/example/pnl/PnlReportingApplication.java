package com.example.pnl;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Multi-level P&L reporting over the account and organisational hierarchies. */
@SpringBootApplication
public class PnlReportingApplication {

  public static void main(String[] args) {
    SpringApplication.run(PnlReportingApplication.class, args);
  }
}
