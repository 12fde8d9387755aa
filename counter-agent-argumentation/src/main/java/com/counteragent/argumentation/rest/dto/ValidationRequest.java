package com.counteragent.argumentation.rest.dto;

public record ValidationRequest(String originalId, CounterPayload counter) {
}
