package com.example.exchange.model;

public enum AvailabilityStatus {
  OPEN,
  WITHDRAWN,
  EXPIRED
}
