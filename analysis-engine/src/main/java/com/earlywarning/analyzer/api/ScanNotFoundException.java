package com.earlywarning.analyzer.api;

/**
 * Thrown when a scan id does not exist in the history store.
 *
 * @author Naveed Gung
 */
public class ScanNotFoundException extends RuntimeException {

    public ScanNotFoundException(String scanId) {
        super("Scan not found: " + scanId);
    }
}
