package com.logistics.fleetopsbackend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FleetOpsBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(FleetOpsBackendApplication.class, args);
    }
}
