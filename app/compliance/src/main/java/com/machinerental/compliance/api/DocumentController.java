/*
 * どこで: Compliance API
 * 何を: 機械書類の登録/更新手続き/削除/参照のエンドポイントを提供する
 * なぜ: 管理画面から書類台帳を操作する入口を提供するため
 */
package com.machinerental.compliance.api;

import com.machinerental.compliance.api.request.BulkRenewRequest;
import com.machinerental.compliance.api.request.RenewDocumentRequest;
import com.machinerental.compliance.api.request.UpsertDocumentRequest;
import com.machinerental.compliance.api.response.BulkRenewResponse;
import com.machinerental.compliance.api.response.DocumentResponse;
import com.machinerental.compliance.api.response.DocumentStatsResponse;
import com.machinerental.compliance.api.response.DocumentsResponse;
import com.machinerental.compliance.api.response.UpsertDocumentResponse;
import com.machinerental.compliance.model.UpsertAction;
import com.machinerental.compliance.model.UpsertResult;
import com.machinerental.compliance.service.DocumentRegistryService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
public class DocumentController {

  private final DocumentRegistryService documentRegistryService;

  @GetMapping("/documents")
  public DocumentsResponse list(
      @RequestParam(name = "machine_id", required = false) Long machineId,
      @RequestParam(name = "document_type", required = false) String documentType,
      @RequestParam(name = "status", required = false) String status,
      @RequestParam(name = "expiring_within_days", required = false) Integer expiringWithinDays) {
    return DocumentsResponse.from(
        documentRegistryService.list(machineId, documentType, status, expiringWithinDays));
  }

  @GetMapping("/documents/expiring")
  public DocumentsResponse expiring(
      @RequestParam(name = "days", defaultValue = "14")
          @Min(value = 0, message = "days must not be negative")
          int days) {
    return DocumentsResponse.from(documentRegistryService.listExpiring(days));
  }

  @GetMapping("/documents/stats")
  public DocumentStatsResponse stats() {
    return DocumentStatsResponse.from(documentRegistryService.stats());
  }

  @GetMapping("/documents/{id}")
  public DocumentResponse get(@PathVariable("id") long documentId) {
    return DocumentResponse.from(documentRegistryService.get(documentId));
  }

  @GetMapping("/machines/{id}/documents")
  public DocumentsResponse listByMachine(@PathVariable("id") long machineId) {
    return DocumentsResponse.from(documentRegistryService.listByMachine(machineId));
  }

  @PutMapping("/documents")
  public ResponseEntity<UpsertDocumentResponse> upsert(
      @Valid @RequestBody UpsertDocumentRequest request) {
    final UpsertResult result =
        documentRegistryService.upsert(
            request.machineId(),
            request.documentType(),
            request.expiryDate(),
            request.lastRenewedDate(),
            request.remarks());
    final HttpStatus status =
        result.action() == UpsertAction.CREATED ? HttpStatus.CREATED : HttpStatus.OK;
    return ResponseEntity.status(status)
        .body(new UpsertDocumentResponse(result.id(), result.action()));
  }

  @PostMapping("/documents/{id}/renewal")
  public DocumentResponse renew(
      @PathVariable("id") long documentId, @Valid @RequestBody RenewDocumentRequest request) {
    return DocumentResponse.from(
        documentRegistryService.renew(documentId, request.newExpiryDate(), request.remarks()));
  }

  @PostMapping("/documents/bulk-renewal")
  public BulkRenewResponse bulkRenew(@Valid @RequestBody BulkRenewRequest request) {
    return new BulkRenewResponse(
        documentRegistryService.bulkRenew(
            request.documentIds(), request.newExpiryDates(), request.remarks()));
  }

  @DeleteMapping("/documents/{id}")
  public ResponseEntity<Void> delete(@PathVariable("id") long documentId) {
    documentRegistryService.delete(documentId);
    return ResponseEntity.noContent().build();
  }
}
