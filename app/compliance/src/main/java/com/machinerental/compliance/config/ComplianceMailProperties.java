/*
 * どこで: Compliance アプリの設定バインド
 * 何を: アラートメールの送信元/宛先と送信方式の切り替えを保持する
 * なぜ: 宛先変更や SMTP 有効化をデプロイ設定だけで行うため
 */
package com.machinerental.compliance.config;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "compliance.mail")
public record ComplianceMailProperties(
    boolean smtpEnabled, String from, List<String> adminEmails, FailureInjection failureInjection) {

  public ComplianceMailProperties {
    // ADMIN_EMAILS の前後空白や空要素は宛先として扱わない
    adminEmails =
        adminEmails == null
            ? List.of()
            : adminEmails.stream()
                .filter(address -> address != null && !address.isBlank())
                .map(String::trim)
                .toList();
  }

  /** CI/Test 専用の送信失敗注入。 */
  public record FailureInjection(boolean enabled, String machineNumberPrefix) {}
}
