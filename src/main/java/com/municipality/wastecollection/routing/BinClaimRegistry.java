package com.municipality.wastecollection.routing;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Authoritative bin to route membership for non-terminal routes.
 * <p>
 * A claim is a {@code putIfAbsent}, so at most one route ever owns a bin. Multi-bin claims
 * acquire in ascending id order and stop at the first conflict, which guarantees that of two
 * overlapping claims at least one succeeds. A retired bin (deactivated) holds a permanent
 * marker no route can displace.
 */
@Slf4j
@Component
public class BinClaimRegistry {

    static final String RETIRED = "retired";

    private final ConcurrentHashMap<String, String> owners = new ConcurrentHashMap<>();

    public boolean claim(String binId, String routeId) {
        String previous = owners.putIfAbsent(binId, routeId);
        return previous == null || previous.equals(routeId);
    }

    /**
     * Claims every bin for the route or none of them.
     *
     * @return the bins owned by someone else; empty when the claim succeeded
     */
    public List<String> claimAll(Collection<String> binIds, String routeId) {
        List<String> acquired = new ArrayList<>();
        for (String binId : new TreeSet<>(binIds)) {
            String previous = owners.putIfAbsent(binId, routeId);
            if (previous == null) {
                acquired.add(binId);
            } else if (!previous.equals(routeId)) {
                acquired.forEach(id -> owners.remove(id, routeId));
                List<String> conflicts = conflictsFor(binIds, routeId);
                log.debug("Claim for route {} lost on bin {} ({} conflicts)", routeId, binId, conflicts.size());
                return conflicts;
            }
        }
        return List.of();
    }

    public boolean release(String binId, String routeId) {
        return owners.remove(binId, routeId);
    }

    public void releaseAll(Collection<String> binIds, String routeId) {
        binIds.forEach(binId -> owners.remove(binId, routeId));
    }

    /**
     * Permanently blocks the bin from being claimed. An existing claim is overridden, so the
     * owning route can still finish its stop but no route can take the bin again.
     */
    public void retire(String binId) {
        owners.put(binId, RETIRED);
    }

    public boolean isClaimed(String binId) {
        return owners.containsKey(binId);
    }

    public Optional<String> ownerOf(String binId) {
        String owner = owners.get(binId);
        return RETIRED.equals(owner) ? Optional.empty() : Optional.ofNullable(owner);
    }

    public int size() {
        return owners.size();
    }

    /**
     * Drops every claim and marker; only used while rebuilding state at startup.
     */
    public void reset() {
        owners.clear();
    }

    private List<String> conflictsFor(Collection<String> binIds, String routeId) {
        List<String> conflicts = new ArrayList<>();
        for (String binId : new TreeSet<>(binIds)) {
            String owner = owners.get(binId);
            if (owner != null && !owner.equals(routeId)) {
                conflicts.add(binId);
            }
        }
        return conflicts;
    }
}
