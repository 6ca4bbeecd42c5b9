package com.example.notifier.api.response;

import com.example.notifier.service.TestDeliveryResult;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TestDeliveryResponse(
    boolean success, String channel, String recipient, String subject, String body, String error) {

  public static TestDeliveryResponse from(TestDeliveryResult result) {
    return new TestDeliveryResponse(
        result.success(),
        result.channel() == null ? null : result.channel().key(),
        result.recipient(),
        result.subject(),
        result.body(),
        result.error());
  }
}
