package com.greenwashradar.pipeline.exception;

/**
 * Oracle answered, but the answer does not fit the expected schema. Never retried.
 */
public class MalformedOutputException extends PipelineException {

    public MalformedOutputException(String message) {
        super(PipelineErrorCode.MALFORMED_OUTPUT, message);
    }

    public MalformedOutputException(String message, Throwable cause) {
        super(PipelineErrorCode.MALFORMED_OUTPUT, message, cause);
    }

    public static MalformedOutputException notJson(Throwable cause) {
        return new MalformedOutputException("Oracle output is not valid JSON even after recovery", cause);
    }

    public static MalformedOutputException invalidField(int index, String field, String reason) {
        return new MalformedOutputException("Item " + index + " field '" + field + "' " + reason);
    }
}
