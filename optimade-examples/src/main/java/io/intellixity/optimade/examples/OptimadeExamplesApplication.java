package io.intellixity.optimade.examples;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OptimadeExamplesApplication {
  public static void main(String[] args) {
    SpringApplication.run(OptimadeExamplesApplication.class, args);
  }
}
