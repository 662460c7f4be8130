package com.lineguard.proposal;

/**
 * Raised instead of scanning when the operational switch is off.
 */
public class SafetyScanDisabledException extends RuntimeException {

    public static final String SAFETY_SCAN_DISABLED = "SAFETY_SCAN_DISABLED";

    public SafetyScanDisabledException() {
        super("Safety scan is disabled by configuration (lineguard.safety-scan.enabled=false)");
    }

    public String getErrorCode() {
        return SAFETY_SCAN_DISABLED;
    }
}
