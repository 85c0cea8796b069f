package com.delta.listener;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class DeltaListenerApplication {

  public static void main(String[] args) {
    SpringApplication.run(DeltaListenerApplication.class, args);
  }
}
