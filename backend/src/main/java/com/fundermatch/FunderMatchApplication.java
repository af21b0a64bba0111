package com.fundermatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class FunderMatchApplication {

  public static void main(String[] args) {
    SpringApplication.run(FunderMatchApplication.class, args);
  }
}
