package com.example.exchange.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "exchange.expiry.enabled", havingValue = "true")
public class AvailabilityExpiryWorker {

  private final AvailabilityExpiryService expiryService;

  @Scheduled(fixedDelayString = "${exchange.expiry.interval:5m}")
  public void run() {
    expiryService.expire();
  }
}
