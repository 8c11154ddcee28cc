package io.b2mash.usagereport;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class UsageReportApplication {

  public static void main(String[] args) {
    System.exit(SpringApplication.exit(SpringApplication.run(UsageReportApplication.class, args)));
  }
}
