package com.ylm.attendance.payroll.exception;

public class ReportStorageException extends RuntimeException {

    public ReportStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
