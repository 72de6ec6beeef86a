package com.scholary.tts.handler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TtsHandlerApplication {

  public static void main(String[] args) {
    SpringApplication.run(TtsHandlerApplication.class, args);
  }
}
