package com.municipality.wastecollection.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Tunables for the collection-coordination engine.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "collection")
public class CollectionProperties {

    private Spatial spatial = new Spatial();
    private Optimizer optimizer = new Optimizer();
    private Tracking tracking = new Tracking();
    private Routes routes = new Routes();

    @Data
    public static class Spatial {
        /**
         * Edge of a grid bucket in degrees (0.01 is roughly 1.1 km of latitude).
         */
        private double cellSizeDegrees = 0.01;
    }

    @Data
    public static class Optimizer {
        /**
         * Search radius used when a seed point is given without a radius.
         */
        private double searchRadiusMeters = 5000;

        /**
         * Maximum distance from a cluster's seed bin to any other bin in the cluster.
         */
        private double clusterRadiusMeters = 1500;

        /**
         * Converts nominal bin volume (liters) to estimated mass (kg).
         */
        private double densityKgPerLiter = 0.2;

        /**
         * Capacity bound for clustering when no truck is available.
         */
        private double defaultTruckCapacityKg = 5000;

        private int maxClaimAttempts = 3;

        /**
         * A FULL bin reported longer ago than this is critical.
         */
        private long criticalAgeHours = 24;

        private double averageSpeedKmh = 25;
        private int serviceMinutesPerStop = 3;

        private Schedule schedule = new Schedule();
    }

    @Data
    public static class Schedule {
        private boolean enabled = true;
        private long intervalMs = 300000;
        private long tickMs = 30000;
    }

    @Data
    public static class Tracking {
        /**
         * Samples kept in memory per driver for live trails.
         */
        private int trailSize = 100;

        /**
         * Samples arriving closer together than this are used for position only, not stored.
         */
        private long minStorageIntervalMs = 5000;

        private int retentionDays = 30;

        // Read by the purge scheduler through a placeholder
        private String retentionCron = "0 30 3 * * *";
    }

    @Data
    public static class Routes {
        /**
         * Complete a route automatically once its last stop is collected.
         */
        private boolean autoComplete = true;
    }
}
