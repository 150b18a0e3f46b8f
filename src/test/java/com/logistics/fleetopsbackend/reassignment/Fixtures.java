package com.logistics.fleetopsbackend.reassignment;

import com.logistics.fleetopsbackend.model.Driver;
import com.logistics.fleetopsbackend.model.DriverSkill;
import com.logistics.fleetopsbackend.model.DriverStatus;
import com.logistics.fleetopsbackend.model.Fleet;
import com.logistics.fleetopsbackend.model.Order;
import com.logistics.fleetopsbackend.model.RouteStop;
import com.logistics.fleetopsbackend.model.StopStatus;
import com.logistics.fleetopsbackend.model.Vehicle;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

final class Fixtures {

    static final String COMPANY = "company1";
    static final String JOB = "job1";
    static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-02T08:00:00Z"), ZoneOffset.UTC);
    static final LocalDateTime NOW = LocalDateTime.now(CLOCK);

    private Fixtures() {
    }

    static Driver driver(String id, String name, String fleetId, DriverStatus status) {
        Driver driver = new Driver();
        driver.setId(id);
        driver.setCompanyId(COMPANY);
        driver.setName(name);
        driver.setFleetId(fleetId);
        driver.setStatus(status);
        driver.setActive(true);
        driver.setLicenseExpiry(NOW.toLocalDate().plusYears(2));
        return driver;
    }

    static DriverSkill skill(String skillId, LocalDateTime expiresAt) {
        return new DriverSkill(skillId, expiresAt, true);
    }

    static RouteStop stop(String id, String routeId, String vehicleId, String driverId, int sequence, StopStatus status) {
        return RouteStop.builder()
                .id(id)
                .companyId(COMPANY)
                .jobId(JOB)
                .routeId(routeId)
                .vehicleId(vehicleId)
                .driverId(driverId)
                .orderId("o-" + id)
                .sequence(sequence)
                .address(sequence + " Avenue Habib Bourguiba")
                .latitude(36.80 + sequence * 0.01)
                .longitude(10.18)
                .status(status)
                .build();
    }

    static List<RouteStop> pendingStops(int count, String routeId, String vehicleId, String driverId) {
        List<RouteStop> stops = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            stops.add(stop(routeId + "-s" + i, routeId, vehicleId, driverId, i, StopStatus.PENDING));
        }
        return stops;
    }

    static Vehicle vehicle(String id, String plate, double weightCapacity, double volumeCapacity) {
        return new Vehicle(id, COMPANY, "fleet1", plate, weightCapacity, volumeCapacity);
    }

    static Order order(String id, double weight, double volume, String... skills) {
        return new Order(id, COMPANY, "TRK-" + id, weight, volume, new HashSet<>(Set.of(skills)));
    }

    static Fleet fleet(String id, String name, String type) {
        return new Fleet(id, COMPANY, name, type);
    }
}
