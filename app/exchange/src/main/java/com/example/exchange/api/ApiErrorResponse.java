package com.example.exchange.api;

public record ApiErrorResponse(String code, String message) {}
