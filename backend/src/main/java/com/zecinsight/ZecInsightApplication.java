package com.zecinsight;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ZecInsightApplication {

    public static void main(String[] args) {
        SpringApplication.run(ZecInsightApplication.class, args);
    }
}
