package com.example.inventory;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class InventoryReconcileApplication {

    public static void main(String[] args) {
        SpringApplication.run(InventoryReconcileApplication.class, args);
    }
}
