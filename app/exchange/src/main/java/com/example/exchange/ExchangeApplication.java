/*
 * どこで: Exchange アプリケーションのエントリポイント
 * 何を: Spring を起動し、設定プロパティを走査し、定期ワーカーを有効にする
 * なぜ: 1 プロセスで HTTP API、ライブチャネル、期限切れワーカーを提供するため
 */
package com.example.exchange;

import com.example.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
@Import(TimeConfig.class)
public class ExchangeApplication {

  public static void main(String[] args) {
    SpringApplication.run(ExchangeApplication.class, args);
  }
}
