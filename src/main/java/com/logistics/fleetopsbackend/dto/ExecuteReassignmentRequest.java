package com.logistics.fleetopsbackend.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request body for executing a chosen reassignment.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ExecuteReassignmentRequest {

    @NotBlank(message = "absentDriverId is required")
    private String absentDriverId;

    private String jobId;

    @NotEmpty(message = "At least one reassignment is required")
    @Valid
    private List<ReassignmentOperationRequest> reassignments;

    @Size(max = 1000, message = "Reason must be at most 1000 characters")
    private String reason;
}
