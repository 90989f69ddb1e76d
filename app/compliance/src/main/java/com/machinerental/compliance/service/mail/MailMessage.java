package com.machinerental.compliance.service.mail;

import java.util.List;

/** 送信するプレーンテキストメール 1 通。 */
public record MailMessage(List<String> to, String subject, String body) {

  public MailMessage {
    to = to == null ? List.of() : List.copyOf(to);
  }
}
