package com.greenwashradar.pipeline.dto;

/**
 * What to ask the report source for.
 */
public record ReportQuery(String companyCode, int reportYear, String companyName) {

    public static ReportQuery of(JobKey key, String companyName) {
        return new ReportQuery(key.companyCode(), key.reportYear(), companyName);
    }
}
