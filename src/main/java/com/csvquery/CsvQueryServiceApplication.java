package com.csvquery;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.transaction.annotation.EnableTransactionManagement;

@SpringBootApplication
@EnableTransactionManagement
public class CsvQueryServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(CsvQueryServiceApplication.class, args);
    }
}
