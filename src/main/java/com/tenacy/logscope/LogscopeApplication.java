package com.tenacy.logscope;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class LogscopeApplication {

    public static void main(String[] args) {
        SpringApplication.run(LogscopeApplication.class, args);
    }
}
