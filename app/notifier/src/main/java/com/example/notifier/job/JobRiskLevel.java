package com.example.notifier.job;

public enum JobRiskLevel {
  LOW,
  MEDIUM,
  HIGH
}
