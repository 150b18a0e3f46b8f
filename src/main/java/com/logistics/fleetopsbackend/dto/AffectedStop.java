package com.logistics.fleetopsbackend.dto;

import com.logistics.fleetopsbackend.model.RouteStop;
import com.logistics.fleetopsbackend.model.StopStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * DTO for one outstanding stop of an affected route.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AffectedStop {
    private String id;
    private String orderId;
    private int sequence;
    private String address;
    private double latitude;
    private double longitude;
    private StopStatus status;
    private LocalDateTime timeWindowStart;
    private LocalDateTime timeWindowEnd;
    private LocalDateTime estimatedArrival;

    public static AffectedStop from(RouteStop stop) {
        return AffectedStop.builder()
                .id(stop.getId())
                .orderId(stop.getOrderId())
                .sequence(stop.getSequence())
                .address(stop.getAddress())
                .latitude(stop.getLatitude())
                .longitude(stop.getLongitude())
                .status(stop.getStatus())
                .timeWindowStart(stop.getTimeWindowStart())
                .timeWindowEnd(stop.getTimeWindowEnd())
                .estimatedArrival(stop.getEstimatedArrival())
                .build();
    }
}
