package com.example.notifier.service;

public class PreferencesNotFoundException extends RuntimeException {

  public PreferencesNotFoundException(String username) {
    super("notification preferences not found username=" + username);
  }
}
