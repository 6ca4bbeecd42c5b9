package com.example.notifier.service;

import com.example.notifier.model.NotificationChannel;

public class RecipientNotFoundException extends RuntimeException {

  public RecipientNotFoundException(String username, NotificationChannel channel) {
    super("no " + channel.key() + " address for username=" + username);
  }
}
