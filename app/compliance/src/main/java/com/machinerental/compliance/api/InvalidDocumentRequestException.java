/*
 * どこで: Compliance API
 * 何を: 書類/通知設定リクエストの妥当性エラーを表現する
 * なぜ: 書き込み前の検証失敗を 400 へ正規化するため
 */
package com.machinerental.compliance.api;

public class InvalidDocumentRequestException extends RuntimeException {
  public InvalidDocumentRequestException(String message) {
    super(message);
  }
}
