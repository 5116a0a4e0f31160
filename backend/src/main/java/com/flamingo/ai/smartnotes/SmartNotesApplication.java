package com.flamingo.ai.smartnotes;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point of the smart notes service. */
@SpringBootApplication
public class SmartNotesApplication {

  public static void main(String[] args) {
    SpringApplication.run(SmartNotesApplication.class, args);
  }
}
