/*
 * どこで: Notifier アプリの設定バインド
 * 何を: ドメインイベント購読に使う NATS 接続設定を読み込む
 * なぜ: 接続断の間もイベントを取りこぼさないよう再接続回数を運用で調整するため
 */
package com.example.notifier.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/** maxReconnects が負なら無制限に再接続する。 */
@ConfigurationProperties(prefix = "nats")
public record NatsProperties(
    boolean enabled,
    String url,
    Integer connectionTimeout,
    String connectionName,
    Integer maxReconnects) {}
