package com.dnobretech.bigdumpbackend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BigDumpBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(BigDumpBackendApplication.class, args);
    }
}
