package com.flamingo.ai.kbsearch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the knowledge base search service. */
@SpringBootApplication
public class KbSearchApplication {

  public static void main(String[] args) {
    SpringApplication.run(KbSearchApplication.class, args);
  }
}
