package com.harness.alertmigration;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AlertFilterMigrationApplication {
  public static void main(String[] args) {
    SpringApplication.run(AlertFilterMigrationApplication.class, args);
  }
}
