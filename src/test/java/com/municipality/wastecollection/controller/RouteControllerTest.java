package com.municipality.wastecollection.controller;

import com.municipality.wastecollection.dto.CreateRouteRequest;
import com.municipality.wastecollection.dto.OptimizationResult;
import com.municipality.wastecollection.exception.CapacityExceededException;
import com.municipality.wastecollection.exception.GlobalExceptionHandler;
import com.municipality.wastecollection.exception.InvalidTransitionException;
import com.municipality.wastecollection.exception.PermissionDeniedException;
import com.municipality.wastecollection.exception.SchedulingConflictException;
import com.municipality.wastecollection.geo.GeoPoint;
import com.municipality.wastecollection.model.CollectionRoute;
import com.municipality.wastecollection.model.RouteStatus;
import com.municipality.wastecollection.routing.RouteLifecycleService;
import com.municipality.wastecollection.routing.RouteOptimizationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class RouteControllerTest {

    private MockMvc mockMvc;
    private RouteOptimizationService optimizationService;
    private RouteLifecycleService lifecycleService;

    private CollectionRoute route;

    @BeforeEach
    void setUp() {
        optimizationService = mock(RouteOptimizationService.class);
        lifecycleService = mock(RouteLifecycleService.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new RouteController(optimizationService, lifecycleService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();

        route = new CollectionRoute();
        route.setId("route-1");
        route.setCode("RT-2024-0A1B2C3D");
        route.setStatus(RouteStatus.ASSIGNED);
    }

    @Test
    void testOptimizeWithoutBody() throws Exception {
        OptimizationResult result = OptimizationResult.empty();
        result.setAttempts(1);
        result.getRoutes().add(route);
        when(optimizationService.runOptimization()).thenReturn(result);

        mockMvc.perform(post("/routes/optimize"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.routes[0].code").value("RT-2024-0A1B2C3D"))
                .andExpect(jsonPath("$.attempts").value(1));
    }

    @Test
    void testOptimizeAroundSeed() throws Exception {
        when(optimizationService.runOptimization(any(GeoPoint.class), any())).thenReturn(OptimizationResult.empty());

        mockMvc.perform(post("/routes/optimize")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"latitude\":36.8,\"longitude\":10.18,\"radiusMeters\":800}"))
                .andExpect(status().isOk());

        verify(optimizationService).runOptimization(new GeoPoint(36.8, 10.18), 800.0);
    }

    @Test
    void testOptimizeWithHalfASeed() throws Exception {
        mockMvc.perform(post("/routes/optimize")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"latitude\":36.8}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("BAD_REQUEST"));

        verifyNoInteractions(optimizationService);
    }

    @Test
    void testCreateRoute() throws Exception {
        when(lifecycleService.createRoute(any(CreateRouteRequest.class))).thenReturn(route);

        mockMvc.perform(post("/routes")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Morning\",\"binIds\":[\"bin-1\",\"bin-2\"]}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("route-1"));
    }

    @Test
    void testCreateRoute_overlap() throws Exception {
        when(lifecycleService.createRoute(any(CreateRouteRequest.class)))
                .thenThrow(new SchedulingConflictException("Bins already scheduled", List.of("bin-2")));

        mockMvc.perform(post("/routes")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"binIds\":[\"bin-1\",\"bin-2\"]}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("SCHEDULING_CONFLICT"))
                .andExpect(jsonPath("$.conflictingBinIds[0]").value("bin-2"));
    }

    @Test
    void testCreateRoute_noBins() throws Exception {
        mockMvc.perform(post("/routes")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"binIds\":[]}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(lifecycleService);
    }

    @Test
    void testAssign_overCapacity() throws Exception {
        when(lifecycleService.assignRoute("route-1", "driver-1", "truck-1"))
                .thenThrow(new CapacityExceededException("truck-1", 480.0, 300.0));

        mockMvc.perform(post("/routes/route-1/assign")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"driverId\":\"driver-1\",\"truckId\":\"truck-1\"}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("CAPACITY_EXCEEDED"));
    }

    @Test
    void testStart_wrongDriver() throws Exception {
        when(lifecycleService.startRoute("route-1", "driver-2"))
                .thenThrow(new PermissionDeniedException("Route route-1 is not assigned to driver driver-2"));

        mockMvc.perform(post("/routes/route-1/start")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"driverId\":\"driver-2\"}"))
                .andExpect(status().isForbidden());
    }

    @Test
    void testCollectWithoutBody() throws Exception {
        when(lifecycleService.markStopCollected("route-1", "bin-1", null, null)).thenReturn(route);

        mockMvc.perform(post("/routes/route-1/stops/bin-1/collect"))
                .andExpect(status().isOk());

        verify(lifecycleService).markStopCollected("route-1", "bin-1", null, null);
    }

    @Test
    void testCollect_onCancelledRoute() throws Exception {
        when(lifecycleService.markStopCollected(eq("route-1"), eq("bin-1"), any(), any()))
                .thenThrow(new InvalidTransitionException("Route route-1 is CANCELLED"));

        mockMvc.perform(post("/routes/route-1/stops/bin-1/collect")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"weightKg\":12.5}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("INVALID_TRANSITION"));
    }

    @Test
    void testCancelWithReason() throws Exception {
        when(lifecycleService.cancelRoute(anyString(), anyString())).thenReturn(route);

        mockMvc.perform(post("/routes/route-1/cancel")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\":\"road closed\"}"))
                .andExpect(status().isOk());

        verify(lifecycleService).cancelRoute("route-1", "road closed");
    }

    @Test
    void testCompleteWithoutDistance() throws Exception {
        when(lifecycleService.completeRoute(eq("route-1"), isNull())).thenReturn(route);

        mockMvc.perform(post("/routes/route-1/complete"))
                .andExpect(status().isOk());

        verify(lifecycleService).completeRoute("route-1", null);
    }

    @Test
    void testListRoutes() throws Exception {
        when(lifecycleService.getActiveRoutes()).thenReturn(List.of(route));
        when(lifecycleService.getRoutesByStatus(RouteStatus.COMPLETED)).thenReturn(List.of());

        mockMvc.perform(get("/routes").param("activeOnly", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].status").value("ASSIGNED"));
        mockMvc.perform(get("/routes").param("status", "COMPLETED"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(0));
    }
}
