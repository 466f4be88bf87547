package com.eainde.intent;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class IntentNegotiationApplication {

    public static void main(String[] args) {
        SpringApplication.run(IntentNegotiationApplication.class, args);
    }
}
