package io.intellixity.docket.examples;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DocketExamplesApplication {
  public static void main(String[] args) {
    SpringApplication.run(DocketExamplesApplication.class, args);
  }
}
