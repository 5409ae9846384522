package com.jobprospector.hiring;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class HiringSignalApplication {

  public static void main(String[] args) {
    SpringApplication.run(HiringSignalApplication.class, args);
  }
}
