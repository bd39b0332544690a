package com.greenwashradar.pipeline.dto;

public enum FetchOutcomeStatus {
    FOUND,
    NO_EVIDENCE,
    FETCH_ERROR
}
