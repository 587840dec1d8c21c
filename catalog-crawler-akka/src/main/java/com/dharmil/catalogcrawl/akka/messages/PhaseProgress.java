package com.dharmil.catalogcrawl.akka.messages;

import com.dharmil.catalogcrawl.model.PhaseSnapshot;
import com.dharmil.catalogcrawl.model.ProductRef;

import java.util.List;

/**
 * Coordinator to session after every applied outcome.
 *
 * @param discovered product references found by the outcome that produced this snapshot
 */
public record PhaseProgress(PhaseSnapshot snapshot, List<ProductRef> discovered) implements CrawlMessage {

    public PhaseProgress {
        discovered = discovered == null ? List.of() : List.copyOf(discovered);
    }
}
