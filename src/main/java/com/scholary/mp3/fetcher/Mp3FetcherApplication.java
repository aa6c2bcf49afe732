package com.scholary.mp3.fetcher;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class Mp3FetcherApplication {

  public static void main(String[] args) {
    SpringApplication.run(Mp3FetcherApplication.class, args);
  }
}
