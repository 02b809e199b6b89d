package com.example.stats_client;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@SpringBootApplication
@RestController
public class StatsClientApplication {

  public static void main(String[] args) {
    SpringApplication.run(StatsClientApplication.class, args);
  }

  @GetMapping("/")
  public String home() {
    return "stats-client: ok";
  }
}
