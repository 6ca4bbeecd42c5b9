package com.example.notifier.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;

/** recipient に "user" を指定すると対象ユーザー自身の連絡先へ送る。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TestNotificationRequest(
    @NotBlank(message = "channel is required") String channel,
    @NotBlank(message = "recipient is required") String recipient) {}
