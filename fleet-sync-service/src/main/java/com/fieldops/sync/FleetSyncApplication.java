package com.fieldops.sync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Field-ops data sync service: keeps fleet positions and plant layers available
 * through a persistent cache, a short-lived memory cache and a rate-limited
 * telematics client, and streams fleet updates to connected dashboards.
 */
@SpringBootApplication
public class FleetSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(FleetSyncApplication.class, args);
    }
}
