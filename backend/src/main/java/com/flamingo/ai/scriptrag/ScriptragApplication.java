package com.flamingo.ai.scriptrag;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Screenplay search and embedding service. */
@SpringBootApplication
public class ScriptragApplication {

  public static void main(String[] args) {
    SpringApplication.run(ScriptragApplication.class, args);
  }
}
