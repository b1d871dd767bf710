package com.telesync.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.telesync")
public class TeleSyncApp {

    public static void main(String[] args) {
        SpringApplication.run(TeleSyncApp.class, args);
    }
}
