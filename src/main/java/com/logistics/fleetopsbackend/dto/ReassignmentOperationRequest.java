package com.logistics.fleetopsbackend.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One route-level move: the named stops of a route/vehicle go to {@code toDriverId}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReassignmentOperationRequest {

    @NotBlank(message = "routeId is required")
    private String routeId;

    @NotBlank(message = "vehicleId is required")
    private String vehicleId;

    @NotBlank(message = "toDriverId is required")
    private String toDriverId;

    @NotEmpty(message = "At least one stop id is required")
    private List<@NotBlank String> stopIds;
}
