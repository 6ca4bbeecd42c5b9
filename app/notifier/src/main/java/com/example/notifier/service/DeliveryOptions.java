package com.example.notifier.service;

/** testMode の間は claim したエントリを testRecipient 宛てに送る。 */
public record DeliveryOptions(int batchSize, boolean testMode, String testRecipient) {

  public DeliveryOptions {
    if (batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be positive");
    }
    if (testMode && (testRecipient == null || testRecipient.isBlank())) {
      throw new IllegalArgumentException("testRecipient is required in testMode");
    }
  }

  public static DeliveryOptions batch(int batchSize) {
    return new DeliveryOptions(batchSize, false, null);
  }
}
