package com.flamingo.ai.pagereader;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the page reader service. */
@SpringBootApplication
public class PageReaderApplication {

  public static void main(String[] args) {
    SpringApplication.run(PageReaderApplication.class, args);
  }
}
