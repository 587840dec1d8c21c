package com.dharmil.catalogcrawl.akka.messages;

import com.dharmil.catalogcrawl.model.PhaseResult;

public record PhaseFinished(PhaseResult result) implements CrawlMessage {
}
