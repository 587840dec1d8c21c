package com.dharmil.catalogcrawl.akka.messages;

import com.dharmil.catalogcrawl.model.PhaseKind;
import com.dharmil.catalogcrawl.model.PhaseSnapshot;

/**
 * @param snapshot full snapshot, task lists included, taken when the batch completed
 */
public record BatchFinished(PhaseKind phase, int batchIndex, PhaseSnapshot snapshot) implements CrawlMessage {
}
