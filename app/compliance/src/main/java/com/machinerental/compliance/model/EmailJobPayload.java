package com.machinerental.compliance.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/** ジョブ種別ごとの型付きペイロード。実装クラスは {@link EmailJobType} に 1 対 1 で登録する。 */
public interface EmailJobPayload {

  @JsonIgnore
  EmailJobType jobType();

  /** 重複送信判定に使う参照先エンティティの識別子。 */
  @JsonIgnore
  String entityId();
}
