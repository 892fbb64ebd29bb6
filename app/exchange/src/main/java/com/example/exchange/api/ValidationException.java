package com.example.exchange.api;

public class ValidationException extends RuntimeException {
  public ValidationException(String message) {
    super(message);
  }
}
