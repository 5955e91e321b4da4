/*
 * どこで: Updater の設定バインド
 * 何を: NATS 接続設定を保持する
 * なぜ: ブローカーのアドレスが環境ごとに異なるため
 */
package com.entitylifecycle.updater.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "nats")
public record NatsProperties(boolean enabled, String url, Integer connectionTimeout) {}
