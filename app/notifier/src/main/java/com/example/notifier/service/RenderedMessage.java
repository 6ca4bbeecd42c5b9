package com.example.notifier.service;

public record RenderedMessage(String subject, String body) {}
