package com.flamingo.ai.climatechat;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Climate question-answering service. */
@SpringBootApplication
public class ClimateChatApplication {

  public static void main(String[] args) {
    SpringApplication.run(ClimateChatApplication.class, args);
  }
}
