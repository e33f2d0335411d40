package com.municipality.wastecollection.routing;

import com.municipality.wastecollection.config.CollectionProperties;
import com.municipality.wastecollection.model.Bin;
import com.municipality.wastecollection.model.FillLevel;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.Comparator;

/**
 * Collection priority of eligible bins.
 * <p>
 * Tiers: CRITICAL (full and reported more than {@code critical-age-hours} ago), HIGH (full),
 * MEDIUM (three quarters). Within a tier the bin reported longest ago comes first, a missing
 * report time counting as oldest. The bin id breaks remaining ties, so the order is total.
 */
@Component
@RequiredArgsConstructor
public class BinPriority {

    public enum Tier {
        CRITICAL("critical"),
        HIGH("high"),
        MEDIUM("medium"),
        NONE("none");

        private final String label;

        Tier(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    private final CollectionProperties properties;

    public Tier tierOf(Bin bin, LocalDateTime now) {
        if (!bin.isNeedsCollection()) {
            return Tier.NONE;
        }
        if (bin.getCurrentFillLevel() == FillLevel.FULL) {
            LocalDateTime threshold = now.minusHours(properties.getOptimizer().getCriticalAgeHours());
            if (bin.getLastReported() == null || bin.getLastReported().isBefore(threshold)) {
                return Tier.CRITICAL;
            }
            return Tier.HIGH;
        }
        return Tier.MEDIUM;
    }

    /**
     * Highest priority first.
     */
    public Comparator<Bin> ordering(LocalDateTime now) {
        return Comparator.<Bin, Tier>comparing(bin -> tierOf(bin, now))
                .thenComparing(staleness())
                .thenComparing(Bin::getId);
    }

    /**
     * Oldest report first, never-reported bins before all others.
     */
    public static Comparator<Bin> staleness() {
        return Comparator.comparing(Bin::getLastReported, Comparator.nullsFirst(Comparator.naturalOrder()));
    }
}
