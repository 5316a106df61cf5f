package com.fsbo.tracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class FsboTrackerApplication {

  public static void main(String[] args) {
    SpringApplication.run(FsboTrackerApplication.class, args);
  }
}
