/*
 * どこで: Compliance サービス層
 * 何を: 書類種別に適用する既定の通知日数を決める設定ソース
 * なぜ: 既定値の保存先や探索順を通知設定サービスから切り離すため
 */
package com.machinerental.compliance.service;

import com.machinerental.compliance.model.DocumentType;
import java.util.List;

public interface NotificationDefaultsSource {

  /** 空でない降順の日数リストを返す。どの設定も使えない場合もフォールバック値を返す。 */
  List<Integer> resolveDays(DocumentType documentType);
}
