package com.logistics.fleetopsbackend.dto;

public enum IssueType {
    NOT_FOUND,
    VALIDATION,
    CAPACITY,
    CONSISTENCY,
    PARTIAL_FAILURE,
    ROLLBACK_FAILURE,
    LICENSE,
    STATUS,
    SKILLS,
    INFO
}
