package com.mk.fx.qa.jmeter.execution;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class JMeterExecutionApplication {

  public static void main(String[] args) {
    SpringApplication.run(JMeterExecutionApplication.class, args);
  }
}
