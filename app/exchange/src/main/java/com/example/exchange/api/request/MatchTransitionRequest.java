package com.example.exchange.api.request;

import jakarta.validation.constraints.NotBlank;

public record MatchTransitionRequest(@NotBlank String action) {}
