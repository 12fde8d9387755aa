package com.counteragent.argumentation.rest.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A counter-argument as submitted by a client: identity, declared type and declared strength.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CounterPayload(String id, String type, String strength) {
}
