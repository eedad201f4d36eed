package com.optionseller;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OptionSellerApplication {

    public static void main(String[] args) {
        SpringApplication.run(OptionSellerApplication.class, args);
    }
}
