package com.example.exchange.api;

import java.util.UUID;

public class CareRequestNotFoundException extends RuntimeException {
  public CareRequestNotFoundException(UUID requestId) {
    super("request not found: " + requestId);
  }
}
