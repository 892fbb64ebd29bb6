package com.example.exchange.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/** 本文の長さはサービス側で検査し、空と長すぎる本文を同じ規則で扱う。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SendMessageRequest(@NotBlank String recipientId, @NotNull String content) {}
