package com.modtools.idconflict.report;

/**
 * Raised when a report or load-order file cannot be produced.
 */
public class ReportException extends RuntimeException {

    public ReportException(String message, Throwable cause) {
        super(message, cause);
    }
}
