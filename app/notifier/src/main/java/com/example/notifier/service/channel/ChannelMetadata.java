package com.example.notifier.service.channel;

/** ChannelProvider に渡す metadata のキー。 */
public final class ChannelMetadata {

  public static final String NOTIFICATION_ID = "notification_id";
  public static final String USERNAME = "username";
  public static final String TRIGGER = "trigger";
  public static final String PRIORITY = "priority";
  public static final String TEST = "test";

  private ChannelMetadata() {}
}
