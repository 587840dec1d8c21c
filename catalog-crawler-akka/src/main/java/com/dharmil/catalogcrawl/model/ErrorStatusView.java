package com.dharmil.catalogcrawl.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorStatusView(String last, long count, double rate) {
}
