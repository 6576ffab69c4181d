package com.example.quotagate.webhook;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "admission.webhook")
public class WebhookProperties {

    /** 決済プロバイダと共有する HMAC シークレット。空の間は全 webhook を拒否する */
    private String secret = "";

    /** 署名タイムスタンプの許容年齢。0 ならリプレイチェックしない */
    private Duration tolerance = Duration.ZERO;

    /** 失敗したイベントを再配送で何回まで処理し直すか */
    private int maxRetries = 5;

    /**
     * true: リトライ枠の残っている失敗イベントに 503 を返し、送信側に再配送させる
     * false: 署名が正しいイベントには常に 200 を返す
     */
    private boolean redeliverOnFailure = false;

    public boolean hasSecret() {
        return secret != null && !secret.isBlank();
    }

    public String getSecret() { return secret; }
    public void setSecret(String secret) { this.secret = secret; }

    public Duration getTolerance() { return tolerance; }
    public void setTolerance(Duration tolerance) { this.tolerance = tolerance; }

    public int getMaxRetries() { return maxRetries; }
    public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

    public boolean isRedeliverOnFailure() { return redeliverOnFailure; }
    public void setRedeliverOnFailure(boolean redeliverOnFailure) { this.redeliverOnFailure = redeliverOnFailure; }
}
