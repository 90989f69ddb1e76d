/*
 * どこで: Compliance API
 * 何を: 参照先 (機械/書類/ジョブ) が存在しないことを表現する
 * なぜ: 未存在を 404 へ正規化するため
 */
package com.machinerental.compliance.api;

public class ResourceNotFoundException extends RuntimeException {
  public ResourceNotFoundException(String message) {
    super(message);
  }

  public static ResourceNotFoundException document(long documentId) {
    return new ResourceNotFoundException("document not found id=" + documentId);
  }
}
