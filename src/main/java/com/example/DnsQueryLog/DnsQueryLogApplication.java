package com.example.DnsQueryLog;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DnsQueryLogApplication {

    public static void main(String[] args) {
        SpringApplication.run(DnsQueryLogApplication.class, args);
    }
}
