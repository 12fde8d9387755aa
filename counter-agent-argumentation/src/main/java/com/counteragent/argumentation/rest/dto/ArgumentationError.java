package com.counteragent.argumentation.rest.dto;

public record ArgumentationError(int status, String statusMessage, String reasonMessage) {
}
