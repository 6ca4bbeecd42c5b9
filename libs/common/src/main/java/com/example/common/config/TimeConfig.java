/*
 * どこで: Common 共通設定
 * 何を: Clock と既定タイムゾーンを DI 可能にする
 * なぜ: スケジュール計算と配信時刻の解決で同一の時刻源とゾーンを使うため
 */
package com.example.common.config;

import java.time.Clock;
import java.time.ZoneId;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  // ジョブ/ユーザーにゾーン指定が無い場合のフォールバック。
  @Bean
  public ZoneId defaultZoneId(@Value("${app.time.default-zone:UTC}") String zone) {
    return ZoneId.of(zone);
  }
}
