package com.example.exchange.live;

import java.io.IOException;

/** クライアント接続 1 本の送信側。 */
public interface LiveTransport {

  void send(String payload) throws IOException;

  boolean isOpen();

  void close();
}
