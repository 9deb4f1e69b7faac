package com.voiceledger.categorizer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class CategorizerApplication {

  public static void main(String[] args) {
    SpringApplication.run(CategorizerApplication.class, args);
  }
}
