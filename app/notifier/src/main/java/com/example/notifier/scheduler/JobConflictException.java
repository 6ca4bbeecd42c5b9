package com.example.notifier.scheduler;

/** 名前の重複や実行中の定義への操作など、現在の状態と衝突する要求。 */
public class JobConflictException extends RuntimeException {

  public JobConflictException(String message) {
    super(message);
  }
}
