package com.machinerental.compliance.model;

/** 一覧検索条件。各項目は null なら条件なし。 */
public record DocumentFilter(
    Long machineId,
    DocumentType documentType,
    DocumentStatusFilter status,
    Integer expiringWithinDays) {

  public static DocumentFilter none() {
    return new DocumentFilter(null, null, null, null);
  }
}
