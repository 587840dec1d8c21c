package com.dharmil.catalogcrawl.resume;

import com.dharmil.catalogcrawl.model.ResumeToken;

/**
 * Decides whether a token's {@code plan_hash} may be trusted before it seeds a session.
 */
public interface PlanHashVerifier {

    /**
     * @throws InvalidResumeTokenException when the token must not be used
     */
    void verify(ResumeToken token);
}
