package com.example.placecache;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class PlaceCacheApplication {
  public static void main(String[] args) {
    SpringApplication.run(PlaceCacheApplication.class, args);
  }
}
