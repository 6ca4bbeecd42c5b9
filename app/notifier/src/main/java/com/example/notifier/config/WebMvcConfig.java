/*
 * どこで: Notifier Web 設定
 * 何を: 管理 API と通知設定 API にだけ RequestMdcInterceptor を掛ける
 * なぜ: actuator のスクレイプでログの MDC を汚さないため
 */
package com.example.notifier.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@RequiredArgsConstructor
public class WebMvcConfig implements WebMvcConfigurer {

  private final RequestMdcInterceptor requestMdcInterceptor;

  @Override
  public void addInterceptors(InterceptorRegistry registry) {
    registry
        .addInterceptor(requestMdcInterceptor)
        .addPathPatterns("/admin/**", "/notification-preferences/**");
  }
}
