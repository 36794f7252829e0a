package com.scholary.relay;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TranscriptionRelayApplication {

  public static void main(String[] args) {
    SpringApplication.run(TranscriptionRelayApplication.class, args);
  }
}
