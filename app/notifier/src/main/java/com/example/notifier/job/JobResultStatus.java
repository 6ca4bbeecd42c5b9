package com.example.notifier.job;

public enum JobResultStatus {
  SUCCESS,
  FAILED,
  TIMEOUT,
  PARTIAL;

  /** PARTIAL は一部の処理が進んだため成功扱いにする。 */
  public boolean isSuccessful() {
    return this == SUCCESS || this == PARTIAL;
  }
}
