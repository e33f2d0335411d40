package com.municipality.wastecollection.service;

import com.municipality.wastecollection.dto.BinEligibleEvent;
import com.municipality.wastecollection.dto.RouteAssignedEvent;
import com.municipality.wastecollection.dto.RouteCancelledEvent;
import com.municipality.wastecollection.dto.RouteCompletedEvent;
import com.municipality.wastecollection.dto.RouteProgressEvent;
import com.municipality.wastecollection.dto.TruckPositionEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

/**
 * Pushes domain events to STOMP subscribers.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CollectionEventRelay {

    static final String BINS_ELIGIBLE = "/topic/bins/eligible";
    static final String ROUTES_ASSIGNED = "/topic/routes/assigned";
    static final String ROUTES_COMPLETED = "/topic/routes/completed";
    static final String ROUTES_CANCELLED = "/topic/routes/cancelled";
    static final String TRUCK_POSITION = "/topic/truck-position";
    static final String ROUTE_PROGRESS = "/topic/route-progress";

    private final SimpMessagingTemplate messagingTemplate;

    @EventListener
    public void onBinEligible(BinEligibleEvent event) {
        messagingTemplate.convertAndSend(BINS_ELIGIBLE, event);
        log.debug("📡 Sent eligible bin {} ({})", event.getBinId(), event.getFillLevel());
    }

    /**
     * Broadcast plus a per-driver destination so the driver app only listens to its own routes.
     */
    @EventListener
    public void onRouteAssigned(RouteAssignedEvent event) {
        messagingTemplate.convertAndSend(ROUTES_ASSIGNED, event);
        if (event.getDriverId() != null) {
            messagingTemplate.convertAndSend(driverDestination(event.getDriverId()), event);
        }
        log.debug("📡 Sent route assignment {} -> driver {}", event.getRouteCode(), event.getDriverId());
    }

    @EventListener
    public void onRouteCompleted(RouteCompletedEvent event) {
        messagingTemplate.convertAndSend(ROUTES_COMPLETED, event);
        log.debug("📡 Sent route completion {} ({} bins)", event.getRouteId(), event.getBinsCollected());
    }

    @EventListener
    public void onRouteCancelled(RouteCancelledEvent event) {
        messagingTemplate.convertAndSend(ROUTES_CANCELLED, event);
        if (event.getDriverId() != null) {
            messagingTemplate.convertAndSend(driverDestination(event.getDriverId()), event);
        }
        log.debug("📡 Sent route cancellation {}", event.getRouteId());
    }

    @EventListener
    public void onTruckPosition(TruckPositionEvent event) {
        messagingTemplate.convertAndSend(TRUCK_POSITION, event);
    }

    @EventListener
    public void onRouteProgress(RouteProgressEvent event) {
        messagingTemplate.convertAndSend(ROUTE_PROGRESS, event);
        log.debug("📡 Sent route progress {} -> {}/{}", event.getRouteId(), event.getCollectedStops(), event.getTotalStops());
    }

    static String driverDestination(String driverId) {
        return "/topic/drivers/" + driverId + "/routes";
    }
}
