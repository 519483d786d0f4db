package com.cronflow.cronflow_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CronflowBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(CronflowBackendApplication.class, args);
    }
}
