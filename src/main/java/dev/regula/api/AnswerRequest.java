package dev.regula.api;

import jakarta.validation.constraints.NotBlank;

/** Request body for {@code POST /api/v1/answers}. Length limits are enforced by the analyzer. */
public record AnswerRequest(@NotBlank(message = "question must not be blank") String question) {}
