/*
 * どこで: Notifier イベント取り込み
 * 何を: 再配信しても回復しないイベント処理失敗を示す例外
 * なぜ: NATS 購読側で TERM と NAK を判断するため
 */
package com.example.notifier.event;

public class DomainEventPermanentException extends RuntimeException {

  public DomainEventPermanentException(String message) {
    super(message);
  }

  public DomainEventPermanentException(String message, Throwable cause) {
    super(message, cause);
  }
}
