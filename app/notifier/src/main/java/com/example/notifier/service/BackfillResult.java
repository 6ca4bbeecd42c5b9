package com.example.notifier.service;

public record BackfillResult(int usersScanned, int rowsInserted, int remainingMissing) {}
