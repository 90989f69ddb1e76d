/*
 * どこで: Compliance ドメインモデル
 * 何を: メール送信ジョブの状態を表す列挙
 * なぜ: DB と処理ロジックの状態を一致させるため
 */
package com.machinerental.compliance.model;

public enum EmailJobStatus {
  PENDING,
  PROCESSING,
  COMPLETED,
  FAILED
}
