package com.ylm.attendance.payroll.exception;

public class ResourceNotFoundException extends RuntimeException {

    public enum ResourceType {
        SALARY_REPORT
    }

    private final ResourceType resourceType;

    public ResourceNotFoundException(String message, ResourceType resourceType) {
        super(message);
        this.resourceType = resourceType;
    }

    public ResourceType getResourceType() {
        return resourceType;
    }
}
