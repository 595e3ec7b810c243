package com.ylm.attendance.payroll.exception;

/**
 * Raised when a salary calculation is requested without any attendance records.
 */
public class NoRecordsProvidedException extends RuntimeException {

    public static final String ERROR_CODE = "NO_RECORDS";

    public NoRecordsProvidedException() {
        super("No attendance records provided");
    }
}
