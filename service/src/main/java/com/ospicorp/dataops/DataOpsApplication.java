package com.ospicorp.dataops;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DataOpsApplication {

  public static void main(String[] args) {
    SpringApplication.run(DataOpsApplication.class, args);
  }
}
