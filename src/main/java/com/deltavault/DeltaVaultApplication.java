package com.deltavault;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DeltaVaultApplication {

    public static void main(String[] args) {
        SpringApplication.run(DeltaVaultApplication.class, args);
    }
}
