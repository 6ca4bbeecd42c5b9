/*
 * どこで: Notifier イベント振り分け
 * 何を: ドメイン操作のグループ単位で通知要求を組み立てる契約
 * なぜ: 操作ごとの宛先/トリガー/優先度の対応を 1 か所ずつに閉じ込めるため
 */
package com.example.notifier.event;

import com.example.notifier.service.NotificationRequest;
import java.util.List;
import java.util.Set;

public interface DomainEventHandler {

  /** 起動時に重複が無いことを検査する。 */
  Set<String> eventTypes();

  /** 通知不要なら空リスト。 */
  List<NotificationRequest> buildRequests(DomainEvent event);
}
