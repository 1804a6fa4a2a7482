package com.sahulatPay.statusProxy;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StatusProxyApplication {

    public static void main(String[] args) {
        SpringApplication.run(StatusProxyApplication.class, args);
    }
}
