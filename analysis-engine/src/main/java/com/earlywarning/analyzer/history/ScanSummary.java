package com.earlywarning.analyzer.history;

import java.time.LocalDate;
import java.util.SortedMap;

/**
 * Aggregate counts over stored scans.
 *
 * @param totalScans      all stored scans
 * @param safeCount       scans rated Safe
 * @param suspiciousCount scans rated Suspicious
 * @param highRiskCount   scans rated High Risk
 * @param scansByDay      scans per UTC calendar day, oldest first
 *
 * @author Naveed Gung
 */
public record ScanSummary(
        long totalScans,
        long safeCount,
        long suspiciousCount,
        long highRiskCount,
        SortedMap<LocalDate, Long> scansByDay) {
}
