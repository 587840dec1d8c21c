package com.dharmil.catalogcrawl.resume;

import com.dharmil.catalogcrawl.model.ResumeToken;

/**
 * Accepts every hash. Tokens are produced by this service and stored next to it.
 */
public class TrustingPlanHashVerifier implements PlanHashVerifier {

    @Override
    public void verify(ResumeToken token) {
        // trusted
    }
}
