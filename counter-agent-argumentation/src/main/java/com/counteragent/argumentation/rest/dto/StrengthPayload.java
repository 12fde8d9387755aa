package com.counteragent.argumentation.rest.dto;

public record StrengthPayload(double score, String mode) {
}
