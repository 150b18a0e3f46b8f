package com.logistics.fleetopsbackend.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A blocking error or an advisory warning, attributed to the field that produced it.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReassignmentIssue {
    private IssueType type;
    private String field;
    private String message;

    public static ReassignmentIssue of(IssueType type, String message) {
        return new ReassignmentIssue(type, null, message);
    }

    public static ReassignmentIssue of(IssueType type, String field, String message) {
        return new ReassignmentIssue(type, field, message);
    }
}
