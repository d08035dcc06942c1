package dev.courier;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the Courier notification gateway.
 *
 * <p>Remote attachment references are checked against the configured allow/deny lists before they
 * are handed on for retrieval.
 */
@SpringBootApplication
public class CourierApplication {
  public static void main(String[] args) {
    SpringApplication.run(CourierApplication.class, args);
  }
}
