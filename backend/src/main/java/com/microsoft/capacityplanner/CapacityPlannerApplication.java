package com.microsoft.capacityplanner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Capacity Reservation Planner
 *
 * Decides how many reserved instances to buy per commitment tier and how to
 * split each period's demand between reserved and on-demand capacity at
 * minimum cost.
 */
@SpringBootApplication
public class CapacityPlannerApplication {

    public static void main(String[] args) {
        SpringApplication.run(CapacityPlannerApplication.class, args);
    }
}
