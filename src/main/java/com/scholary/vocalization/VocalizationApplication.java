package com.scholary.vocalization;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VocalizationApplication {

  public static void main(String[] args) {
    SpringApplication.run(VocalizationApplication.class, args);
  }
}
