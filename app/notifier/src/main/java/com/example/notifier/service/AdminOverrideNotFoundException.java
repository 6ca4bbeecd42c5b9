package com.example.notifier.service;

import com.example.notifier.model.OverrideTarget;

public class AdminOverrideNotFoundException extends RuntimeException {

  public AdminOverrideNotFoundException(OverrideTarget target) {
    super(
        "admin override not found target_type="
            + target.type()
            + " username="
            + target.username()
            + " target_key="
            + target.targetKey());
  }
}
