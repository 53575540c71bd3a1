package com.ospicorp.waterquality;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WaterQualityApplication {

  public static void main(String[] args) {
    SpringApplication.run(WaterQualityApplication.class, args);
  }
}
