package com.joinwatch.tracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class JoinWatchApplication {

  public static void main(String[] args) {
    SpringApplication.run(JoinWatchApplication.class, args);
  }
}
