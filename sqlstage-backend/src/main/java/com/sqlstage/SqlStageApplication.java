package com.sqlstage;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SqlStageApplication {

    public static void main(String[] args) {
        SpringApplication.run(SqlStageApplication.class, args);
    }
}
