package com.letterboxed;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LetterBoxedApplication {
  public static void main(String[] args) {
    SpringApplication.run(LetterBoxedApplication.class, args);
  }
}
