package com.example.exchange.live;

/** クライアントがライブチャネルで送ってよいフレーム。 */
public enum ClientFrameType {
  RESUME("resume"),
  PING("ping");

  private final String value;

  ClientFrameType(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public static ClientFrameType fromValue(String type) {
    for (ClientFrameType frameType : values()) {
      if (frameType.value.equals(type)) {
        return frameType;
      }
    }
    throw new IllegalArgumentException("unsupported frame type: " + type);
  }
}
