package com.logistics.fleetopsbackend.reassignment;

import com.logistics.fleetopsbackend.dto.ReassignmentOutput;
import com.logistics.fleetopsbackend.dto.ReassignmentOutput.DriverRouteOutput;
import com.logistics.fleetopsbackend.exception.ResourceNotFoundException;
import com.logistics.fleetopsbackend.model.ReassignmentHistory;
import com.logistics.fleetopsbackend.model.ReassignmentHistory.ReassignmentDetail;
import com.logistics.fleetopsbackend.model.RouteStop;
import com.logistics.fleetopsbackend.model.StopStatus;
import com.logistics.fleetopsbackend.repository.ReassignmentHistoryRepository;
import com.logistics.fleetopsbackend.repository.RouteStopRepository;
import com.logistics.fleetopsbackend.repository.VehicleRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static com.logistics.fleetopsbackend.reassignment.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ReassignmentOutputServiceTest {

    @Mock
    private ReassignmentHistoryRepository historyRepository;

    @Mock
    private RouteStopRepository routeStopRepository;

    @Mock
    private VehicleRepository vehicleRepository;

    private ReassignmentOutputService service;
    private InMemoryStopStore store;

    @BeforeEach
    void setUp() {
        service = new ReassignmentOutputService(historyRepository, routeStopRepository, vehicleRepository, CLOCK);
        store = new InMemoryStopStore();
        store.wire(routeStopRepository);
        lenient().when(vehicleRepository.findByCompanyIdAndIdIn(eq(COMPANY), anyCollection()))
                .thenReturn(List.of(vehicle("v1", "123 TU 4567", 1000, 10)));
    }

    @Test
    void testGenerateOutput_oneSheetPerReplacementDriver() {
        store.add(stop("s2", "r1", "v1", "c1", 2, StopStatus.PENDING))
                .add(stop("s1", "r1", "v1", "c1", 1, StopStatus.COMPLETED))
                .add(stop("s3", "r2", "v2", "c1", 1, StopStatus.PENDING))
                .add(stop("s4", "r3", "v3", "c2", 1, StopStatus.PENDING));
        when(historyRepository.findByIdAndCompanyId("h1", COMPANY)).thenReturn(Optional.of(history(
                detail("c1", "Carla", "r1", "v1", "s1", "s2"),
                detail("c1", "Carla", "r2", "v2", "s3"),
                detail("c2", "Emna", "r3", "v3", "s4"))));

        ReassignmentOutput output = service.generateOutput(COMPANY, "h1", "planner1");

        assertEquals("h1", output.getReassignmentHistoryId());
        assertEquals(NOW, output.getGeneratedAt());
        assertEquals("planner1", output.getGeneratedBy());
        assertEquals(2, output.getDriverRoutes().size());

        DriverRouteOutput carla = output.getDriverRoutes().get(0);
        assertEquals("Carla", carla.getDriverName());
        assertEquals("123 TU 4567", carla.getVehiclePlate());
        assertEquals(3, carla.getTotalStops());
        assertEquals(2, carla.getPendingStops());
        assertEquals(1, carla.getCompletedStops());
        assertEquals(List.of("o-s1", "o-s3", "o-s2"),
                carla.getStops().stream().map(ReassignmentOutput.StopLine::getOrderId).collect(Collectors.toList()));

        assertEquals("Unknown", output.getDriverRoutes().get(1).getVehiclePlate());
        assertEquals(4, output.getSummary().getTotalStops());
        assertEquals(3, output.getSummary().getTotalRoutes());
        assertEquals(2, output.getSummary().getTotalReplacementDrivers());
    }

    @Test
    void testGenerateOutput_recordedStopsMovedOn_fallsBackToCurrentStops() {
        store.add(stop("s1", "r1", "v1", "someoneElse", 1, StopStatus.PENDING));
        when(routeStopRepository.findByCompanyIdAndDriverId(COMPANY, "c1"))
                .thenReturn(List.of(stop("s7", "r5", "v1", "c1", 4, StopStatus.PENDING)));
        when(historyRepository.findByIdAndCompanyId("h1", COMPANY)).thenReturn(Optional.of(history(
                detail("c1", "Carla", "r1", "v1", "s1"))));

        ReassignmentOutput output = service.generateOutput(COMPANY, "h1", "planner1");

        DriverRouteOutput sheet = output.getDriverRoutes().get(0);
        assertEquals(1, sheet.getTotalStops());
        assertEquals("o-s7", sheet.getStops().get(0).getOrderId());
    }

    @Test
    void testGenerateOutput_unknownHistory_throws() {
        when(historyRepository.findByIdAndCompanyId("nope", COMPANY)).thenReturn(Optional.empty());

        assertThrows(ResourceNotFoundException.class, () -> service.generateOutput(COMPANY, "nope", "planner1"));
        verifyNoInteractions(vehicleRepository);
    }

    private static ReassignmentHistory history(ReassignmentDetail... details) {
        return ReassignmentHistory.builder()
                .id("h1")
                .companyId(COMPANY)
                .absentDriverId("d0")
                .absentDriverName("Dali")
                .reassignments(List.of(details))
                .routeIds(List.of(details).stream().map(ReassignmentDetail::getRouteId).distinct()
                        .collect(Collectors.toList()))
                .vehicleIds(List.of(details).stream().map(ReassignmentDetail::getVehicleId).distinct()
                        .collect(Collectors.toList()))
                .executedAt(NOW.minusHours(1))
                .build();
    }

    private static ReassignmentDetail detail(String driverId, String name, String routeId, String vehicleId,
                                             String... stopIds) {
        return ReassignmentDetail.builder()
                .driverId(driverId)
                .driverName(name)
                .routeId(routeId)
                .vehicleId(vehicleId)
                .stopIds(List.of(stopIds))
                .stopCount(stopIds.length)
                .build();
    }
}
