package com.example.exchange.api;

import java.util.UUID;

public class OfferNotFoundException extends RuntimeException {
  public OfferNotFoundException(UUID offerId) {
    super("offer not found: " + offerId);
  }
}
