package com.example.exchange.api.response;

public record ReadAllResponse(int updated) {}
