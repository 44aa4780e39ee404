package com.shopfloor.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ShopfloorBackendApplication {
  public static void main(String[] args) {
    SpringApplication.run(ShopfloorBackendApplication.class, args);
  }
}
