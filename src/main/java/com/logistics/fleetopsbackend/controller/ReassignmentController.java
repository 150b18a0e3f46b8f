package com.logistics.fleetopsbackend.controller;

import com.logistics.fleetopsbackend.config.ReassignmentProperties;
import com.logistics.fleetopsbackend.dto.AffectedRoute;
import com.logistics.fleetopsbackend.dto.CandidateDriver;
import com.logistics.fleetopsbackend.dto.ExecuteReassignmentRequest;
import com.logistics.fleetopsbackend.dto.ExecutionResult;
import com.logistics.fleetopsbackend.dto.HistoryEntryView;
import com.logistics.fleetopsbackend.dto.ImpactReport;
import com.logistics.fleetopsbackend.dto.IssueType;
import com.logistics.fleetopsbackend.dto.ReassignmentOption;
import com.logistics.fleetopsbackend.dto.ReassignmentOutput;
import com.logistics.fleetopsbackend.dto.ReassignmentStatusSummary;
import com.logistics.fleetopsbackend.exception.ResourceNotFoundException;
import com.logistics.fleetopsbackend.reassignment.AffectedWorkLocator;
import com.logistics.fleetopsbackend.reassignment.CandidateRanker;
import com.logistics.fleetopsbackend.reassignment.ImpactCalculator;
import com.logistics.fleetopsbackend.reassignment.OptionGenerator;
import com.logistics.fleetopsbackend.reassignment.ReassignmentExecutor;
import com.logistics.fleetopsbackend.reassignment.ReassignmentHistoryService;
import com.logistics.fleetopsbackend.reassignment.ReassignmentOutputService;
import com.logistics.fleetopsbackend.reassignment.ReassignmentStrategy;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.security.Principal;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/reassignment")
@RequiredArgsConstructor
@Tag(name = "Driver Reassignment", description = "Move an unavailable driver's outstanding stops to other drivers")
public class ReassignmentController {

    static final String COMPANY_HEADER = "X-Company-Id";
    static final String USER_HEADER = "X-User-Id";

    private final AffectedWorkLocator affectedWorkLocator;
    private final CandidateRanker candidateRanker;
    private final ImpactCalculator impactCalculator;
    private final OptionGenerator optionGenerator;
    private final ReassignmentExecutor reassignmentExecutor;
    private final ReassignmentHistoryService historyService;
    private final ReassignmentOutputService outputService;
    private final ReassignmentProperties properties;

    @Operation(summary = "Get affected routes",
            description = "Outstanding (pending or in progress) stops of a driver, grouped per route and vehicle")
    @GetMapping("/drivers/{driverId}/affected-routes")
    public List<AffectedRoute> getAffectedRoutes(
            @RequestHeader(COMPANY_HEADER) String companyId,
            @Parameter(description = "Unavailable driver ID") @PathVariable String driverId,
            @RequestParam(required = false) String jobId) {
        return affectedWorkLocator.locateAffectedWork(companyId, driverId, jobId);
    }

    @Operation(summary = "Get replacement candidates",
            description = "Active AVAILABLE drivers ordered by fleet affinity, then name")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Candidates ranked"),
        @ApiResponse(responseCode = "400", description = "Invalid limit or strategy")
    })
    @GetMapping("/drivers/{driverId}/candidates")
    public ResponseEntity<?> getCandidates(
            @RequestHeader(COMPANY_HEADER) String companyId,
            @PathVariable String driverId,
            @RequestParam(defaultValue = "SAME_FLEET") ReassignmentStrategy strategy,
            @RequestParam(required = false) String jobId,
            @RequestParam(required = false) Integer limit) {
        try {
            int size = checkLimit(limit, properties.getDefaultCandidateLimit(), properties.getMaxCandidateLimit());
            List<CandidateDriver> candidates = candidateRanker.rankCandidates(companyId, driverId, strategy, jobId, size);
            return ResponseEntity.ok(candidates);
        } catch (RuntimeException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @Operation(summary = "Compute reassignment impact",
            description = "Impact of one candidate taking over all of the driver's outstanding stops")
    @GetMapping("/drivers/{driverId}/impact/{candidateId}")
    public ImpactReport getImpact(
            @RequestHeader(COMPANY_HEADER) String companyId,
            @PathVariable String driverId,
            @Parameter(description = "Replacement candidate ID") @PathVariable String candidateId,
            @RequestParam(required = false) String jobId) {
        return impactCalculator.computeImpact(companyId, driverId, candidateId, jobId);
    }

    @Operation(summary = "Get reassignment options",
            description = "Candidates paired with their impact, valid options first, then by priority tier")
    @GetMapping("/drivers/{driverId}/options")
    public ResponseEntity<?> getOptions(
            @RequestHeader(COMPANY_HEADER) String companyId,
            @PathVariable String driverId,
            @RequestParam(defaultValue = "SAME_FLEET") ReassignmentStrategy strategy,
            @RequestParam(required = false) String jobId,
            @RequestParam(required = false) Integer limit) {
        try {
            int size = checkLimit(limit, properties.getDefaultOptionLimit(), properties.getMaxCandidateLimit());
            List<ReassignmentOption> options = optionGenerator.generateOptions(companyId, driverId, strategy, jobId, size);
            return ResponseEntity.ok(options);
        } catch (RuntimeException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @Operation(summary = "Execute a reassignment", description = "Moves the named stops all-or-nothing and records the history entry")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Reassignment applied"),
        @ApiResponse(responseCode = "400", description = "Rejected before any change"),
        @ApiResponse(responseCode = "404", description = "Absent driver not found"),
        @ApiResponse(responseCode = "409", description = "Stops were reassigned concurrently, nothing applied"),
        @ApiResponse(responseCode = "500", description = "Failed and could not be fully rolled back")
    })
    @PostMapping("/execute")
    public ResponseEntity<ExecutionResult> execute(
            @RequestHeader(COMPANY_HEADER) String companyId,
            @RequestHeader(value = USER_HEADER, required = false) String userHeader,
            @Valid @RequestBody ExecuteReassignmentRequest request,
            Principal principal) {
        String actor = actorOf(principal, userHeader);

        ExecutionResult result = reassignmentExecutor.executeReassignment(companyId, request.getAbsentDriverId(),
                request.getReassignments(), request.getReason(), actor, request.getJobId());

        return ResponseEntity.status(statusOf(result)).body(result);
    }

    @Operation(summary = "Get reassignment history", description = "Newest first, optionally filtered by job and driver")
    @GetMapping("/history")
    public List<HistoryEntryView> getHistory(
            @RequestHeader(COMPANY_HEADER) String companyId,
            @RequestParam(required = false) String jobId,
            @RequestParam(required = false) String driverId,
            @RequestParam(defaultValue = "0") int limit,
            @RequestParam(defaultValue = "0") long offset) {
        return historyService.getHistory(companyId, jobId, driverId, limit, offset);
    }

    @Operation(summary = "Get reassignment status", description = "Absent drivers and reassignments of the last 24 hours")
    @GetMapping("/status")
    public ReassignmentStatusSummary getStatus(@RequestHeader(COMPANY_HEADER) String companyId) {
        return historyService.getStatusSummary(companyId);
    }

    @Operation(summary = "Regenerate route sheets", description = "Route sheets of the drivers who received work in one reassignment")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Output generated"),
        @ApiResponse(responseCode = "404", description = "History entry not found")
    })
    @GetMapping("/output/{historyId}")
    public ResponseEntity<?> getOutput(
            @RequestHeader(COMPANY_HEADER) String companyId,
            @RequestHeader(value = USER_HEADER, required = false) String userHeader,
            @PathVariable String historyId,
            Principal principal) {
        try {
            ReassignmentOutput output = outputService.generateOutput(companyId, historyId,
                    actorOf(principal, userHeader));
            return ResponseEntity.ok(output);
        } catch (ResourceNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        } catch (RuntimeException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    // The authenticated principal wins; the header only names the actor for unauthenticated callers
    private static String actorOf(Principal principal, String userHeader) {
        return principal != null ? principal.getName() : userHeader;
    }

    private static int checkLimit(Integer limit, int defaultLimit, int maxLimit) {
        if (limit == null) {
            return defaultLimit;
        }
        if (limit < 1 || limit > maxLimit) {
            throw new IllegalArgumentException("limit must be between 1 and " + maxLimit);
        }
        return limit;
    }

    static HttpStatus statusOf(ExecutionResult result) {
        if (result.isSuccess()) {
            return HttpStatus.OK;
        }
        if (result.hasErrorOfType(IssueType.ROLLBACK_FAILURE)) {
            return HttpStatus.INTERNAL_SERVER_ERROR;
        }
        if (result.hasErrorOfType(IssueType.CONSISTENCY) || result.hasErrorOfType(IssueType.PARTIAL_FAILURE)) {
            return HttpStatus.CONFLICT;
        }
        if (result.getErrors().size() == 1 && result.hasErrorOfType(IssueType.NOT_FOUND)
                && "absentDriverId".equals(result.getErrors().get(0).getField())) {
            return HttpStatus.NOT_FOUND;
        }
        return HttpStatus.BAD_REQUEST;
    }
}
