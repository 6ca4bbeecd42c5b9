package com.example.notifier.job;

public enum JobParameterType {
  STRING,
  INTEGER,
  BOOLEAN,
  EMAIL
}
