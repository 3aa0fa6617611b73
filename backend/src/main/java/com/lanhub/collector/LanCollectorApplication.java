package com.lanhub.collector;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class LanCollectorApplication {

  public static void main(String[] args) {
    SpringApplication.run(LanCollectorApplication.class, args);
  }
}
