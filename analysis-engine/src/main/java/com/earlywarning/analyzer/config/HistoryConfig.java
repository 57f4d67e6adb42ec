package com.earlywarning.analyzer.config;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Scan history retention.
 *
 * @author Naveed Gung
 */
@Validated
@ConfigurationProperties(prefix = "analyzer.history")
public class HistoryConfig {

    @Min(1)
    private int maxRecords = 10_000;

    public int getMaxRecords() {
        return maxRecords;
    }

    public void setMaxRecords(int maxRecords) {
        this.maxRecords = maxRecords;
    }
}
