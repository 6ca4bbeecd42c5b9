/*
 * どこで: Notifier アプリの設定バインド
 * 何を: 配信ワーカーのバッチ/リトライ/処理中タイムアウト設定を保持する
 * なぜ: 運用パラメータを外部化するため
 */
package com.example.notifier.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "notification.delivery")
public record NotificationDeliveryProperties(
    int defaultBatchSize,
    int maxAttempts,
    Duration backoffBase,
    Duration backoffMax,
    double backoffExponentBase,
    double backoffJitterMin,
    double backoffJitterMax,
    Duration backoffMin,
    int errorMessageMaxLength,
    Duration processingTimeout) {}
