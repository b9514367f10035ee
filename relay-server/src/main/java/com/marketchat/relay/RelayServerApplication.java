package com.marketchat.relay;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RelayServerApplication {

  public static void main(String[] args) {
    SpringApplication.run(RelayServerApplication.class, args);
  }
}
