package com.greenwashradar.pipeline.exception;

/**
 * The report source or the local archive has no document for the requested company and year.
 */
public class DocumentNotFoundException extends PipelineException {

    public DocumentNotFoundException(String message, String jobKey) {
        super(PipelineErrorCode.REPORT_NOT_FOUND, message, jobKey);
    }

    public static DocumentNotFoundException atSource(String companyCode, int reportYear) {
        return new DocumentNotFoundException(
                "No sustainability report for " + companyCode + " in " + reportYear,
                reportYear + "_" + companyCode);
    }

    public static DocumentNotFoundException inArchive(String jobKey) {
        return new DocumentNotFoundException("Archived report document is missing for " + jobKey, jobKey);
    }
}
