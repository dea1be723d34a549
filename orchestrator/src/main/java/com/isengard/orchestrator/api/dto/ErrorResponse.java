package com.isengard.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.isengard.orchestrator.validation.ValidationException.Violation;

import java.util.List;

/** The only error shape clients see: a type tag and a message, never a stack trace. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(String type, String message, List<Violation> violations) {}
