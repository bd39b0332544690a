package com.greenwashradar.pipeline.client;

import com.greenwashradar.pipeline.dto.VerificationRequest;
import com.greenwashradar.pipeline.dto.VerificationVerdict;

/**
 * Checks evidence links and finds replacements for dead ones.
 * A probe request returns LIVE or DEAD for the candidate URL; a repair request returns
 * LIVE with a replacement URL, or DEAD when nothing usable was found.
 */
public interface SecondaryVerificationOracle {

    VerificationVerdict verify(VerificationRequest request);
}
