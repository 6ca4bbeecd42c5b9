package com.example.notifier.service.channel;

public class ChannelProviderException extends RuntimeException {

  public ChannelProviderException(String message) {
    super(message);
  }

  public ChannelProviderException(String message, Throwable cause) {
    super(message, cause);
  }
}
