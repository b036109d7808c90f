package com.flamingo.ai.reportextract;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the report field extractor. */
@SpringBootApplication
public class ReportExtractApplication {

  public static void main(String[] args) {
    System.exit(
        SpringApplication.exit(SpringApplication.run(ReportExtractApplication.class, args)));
  }
}
