package com.mk.fx.qa.boundary.analysis;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BoundaryAnalysisApplication {

  public static void main(String[] args) {
    SpringApplication.run(BoundaryAnalysisApplication.class, args);
  }
}
