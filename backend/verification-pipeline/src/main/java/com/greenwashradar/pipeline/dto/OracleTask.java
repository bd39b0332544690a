package com.greenwashradar.pipeline.dto;

public enum OracleTask {
    CLAIM_EXTRACTION,
    CROSS_CHECK
}
