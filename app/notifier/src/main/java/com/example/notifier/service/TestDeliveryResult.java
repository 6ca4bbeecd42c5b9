package com.example.notifier.service;

import com.example.notifier.model.NotificationChannel;

public record TestDeliveryResult(
    boolean success,
    NotificationChannel channel,
    String recipient,
    String subject,
    String body,
    String error) {}
