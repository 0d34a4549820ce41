package com.demoClinic.diagnosisDemo;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DiagnosisDemoApplication {

    public static void main(String[] args) {
        SpringApplication.run(DiagnosisDemoApplication.class, args);
    }
}
