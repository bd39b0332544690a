package com.greenwashradar.pipeline.dto;

public enum EvidenceLiveness {
    LIVE,
    DEAD,
    UNCHECKED
}
