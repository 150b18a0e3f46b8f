package com.logistics.fleetopsbackend.reassignment;

import com.logistics.fleetopsbackend.dto.AffectedRoute;
import com.logistics.fleetopsbackend.model.RouteStop;
import com.logistics.fleetopsbackend.model.StopStatus;
import com.logistics.fleetopsbackend.repository.RouteStopRepository;
import com.logistics.fleetopsbackend.repository.VehicleRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static com.logistics.fleetopsbackend.reassignment.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AffectedWorkLocatorTest {

    @Mock
    private RouteStopRepository routeStopRepository;

    @Mock
    private VehicleRepository vehicleRepository;

    @InjectMocks
    private AffectedWorkLocator locator;

    @Test
    void testLocateAffectedWork_groupsPerRouteAndCounts() {
        List<RouteStop> stops = List.of(
                stop("s3", "r2", "v2", "d1", 1, StopStatus.PENDING),
                stop("s2", "r1", "v1", "d1", 2, StopStatus.PENDING),
                stop("s1", "r1", "v1", "d1", 1, StopStatus.IN_PROGRESS));
        when(routeStopRepository.findByCompanyIdAndDriverIdAndStatusIn(COMPANY, "d1",
                AffectedWorkLocator.OPEN_STATUSES)).thenReturn(stops);
        when(vehicleRepository.findByCompanyIdAndIdIn(eq(COMPANY), anyCollection()))
                .thenReturn(List.of(vehicle("v1", "TU-123", 1000, 20)));

        List<AffectedRoute> routes = locator.locateAffectedWork(COMPANY, "d1", null);

        assertEquals(2, routes.size());

        AffectedRoute r1 = routes.get(0);
        assertEquals("r1", r1.getRouteId());
        assertEquals("TU-123", r1.getVehiclePlate());
        assertEquals(2, r1.getTotalStops());
        assertEquals(1, r1.getPendingStops());
        assertEquals(1, r1.getInProgressStops());
        assertEquals("s1", r1.getStops().get(0).getId());
        assertEquals("s2", r1.getStops().get(1).getId());

        AffectedRoute r2 = routes.get(1);
        assertEquals("Unknown", r2.getVehiclePlate());
        assertEquals(1, r2.getPendingStops());
    }

    @Test
    void testLocateAffectedWork_jobScopeUsesJobQuery() {
        when(routeStopRepository.findByCompanyIdAndJobIdAndDriverIdAndStatusIn(COMPANY, JOB, "d1",
                AffectedWorkLocator.OPEN_STATUSES))
                .thenReturn(List.of(stop("s1", "r1", "v1", "d1", 1, StopStatus.PENDING)));

        List<AffectedRoute> routes = locator.locateAffectedWork(COMPANY, "d1", JOB);

        assertEquals(1, routes.size());
        verify(routeStopRepository, never()).findByCompanyIdAndDriverIdAndStatusIn(any(), any(), any());
    }

    @Test
    void testLocateAffectedWork_noWork_emptyNotError() {
        List<AffectedRoute> routes = locator.locateAffectedWork(COMPANY, "d1", null);

        assertTrue(routes.isEmpty());
        verifyNoInteractions(vehicleRepository);
    }

    @Test
    void testLocateAffectedWork_repeatedReadsAreIdentical() {
        when(routeStopRepository.findByCompanyIdAndDriverIdAndStatusIn(COMPANY, "d1",
                AffectedWorkLocator.OPEN_STATUSES))
                .thenReturn(List.of(
                        stop("s2", "r1", "v1", "d1", 2, StopStatus.PENDING),
                        stop("s1", "r1", "v1", "d1", 1, StopStatus.PENDING)));

        assertEquals(locator.locateAffectedWork(COMPANY, "d1", null),
                locator.locateAffectedWork(COMPANY, "d1", null));
    }
}
