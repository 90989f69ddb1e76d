/*
 * どこで: Compliance 書類 API の Web 層テスト
 * 何を: 登録/更新のステータス分岐、入力検証、404 変換を検証する
 * なぜ: クライアントに一貫した {code, message} 応答を返すため
 */
package com.machinerental.compliance.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.machinerental.compliance.model.DocumentType;
import com.machinerental.compliance.model.ExpiryStatus;
import com.machinerental.compliance.model.MachineDocumentView;
import com.machinerental.compliance.model.UpsertAction;
import com.machinerental.compliance.model.UpsertResult;
import com.machinerental.compliance.service.DocumentRegistryService;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(DocumentController.class)
@Import(ApiExceptionHandler.class)
class DocumentControllerTest {

  private static final Instant CREATED_AT = Instant.parse("2026-01-01T00:00:00Z");

  @Autowired private MockMvc mockMvc;

  @MockitoBean private DocumentRegistryService documentRegistryService;

  @Test
  void upsertReturnsCreatedForNewDocument() throws Exception {
    when(documentRegistryService.upsert(
            eq(3L), eq("PUC"), eq(LocalDate.of(2026, 9, 1)), isNull(), isNull()))
        .thenReturn(new UpsertResult(11L, UpsertAction.CREATED));
    final String body =
        """
        {
          "machine_id": 3,
          "document_type": "PUC",
          "expiry_date": "2026-09-01"
        }
        """;

    mockMvc
        .perform(put("/v1/documents").contentType(MediaType.APPLICATION_JSON).content(body))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.id").value(11))
        .andExpect(jsonPath("$.action").value("CREATED"));
  }

  @Test
  void upsertReturnsOkForExistingDocument() throws Exception {
    when(documentRegistryService.upsert(anyLong(), any(), any(), any(), any()))
        .thenReturn(new UpsertResult(11L, UpsertAction.UPDATED));
    final String body =
        """
        {
          "machine_id": 3,
          "document_type": "PUC",
          "expiry_date": "2026-09-01",
          "last_renewed_date": "2026-03-01",
          "remarks": "renewed at RTO"
        }
        """;

    mockMvc
        .perform(put("/v1/documents").contentType(MediaType.APPLICATION_JSON).content(body))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.action").value("UPDATED"));
  }

  @Test
  void upsertReturnsBadRequestWhenExpiryDateMissing() throws Exception {
    final String body =
        """
        {
          "machine_id": 3,
          "document_type": "PUC"
        }
        """;

    mockMvc
        .perform(put("/v1/documents").contentType(MediaType.APPLICATION_JSON).content(body))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("BAD_REQUEST"))
        .andExpect(jsonPath("$.message").value("expiry_date is required"));
    verifyNoInteractions(documentRegistryService);
  }

  @Test
  void upsertReturnsBadRequestWhenDocumentTypeUnknown() throws Exception {
    when(documentRegistryService.upsert(anyLong(), eq("Permit"), any(), any(), any()))
        .thenThrow(
            new InvalidDocumentRequestException(
                "document_type must be one of RC_Book, PUC, Fitness, Insurance"));
    final String body =
        """
        {
          "machine_id": 3,
          "document_type": "Permit",
          "expiry_date": "2026-09-01"
        }
        """;

    mockMvc
        .perform(put("/v1/documents").contentType(MediaType.APPLICATION_JSON).content(body))
        .andExpect(status().isBadRequest())
        .andExpect(
            jsonPath("$.message")
                .value("document_type must be one of RC_Book, PUC, Fitness, Insurance"));
  }

  @Test
  void renewReturnsBadRequestWhenBodyMissing() throws Exception {
    mockMvc
        .perform(post("/v1/documents/8/renewal").contentType(MediaType.APPLICATION_JSON))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("request body is required"));
  }

  @Test
  void getReturnsDocumentWithDerivedFields() throws Exception {
    when(documentRegistryService.get(8L)).thenReturn(view(8L));

    mockMvc
        .perform(get("/v1/documents/8"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.document_type").value("Insurance"))
        .andExpect(jsonPath("$.days_until_expiry").value(5))
        .andExpect(jsonPath("$.status").value("WARNING"))
        .andExpect(jsonPath("$.notification_days[0]").value(7));
  }

  @Test
  void getReturnsNotFoundForUnknownDocument() throws Exception {
    when(documentRegistryService.get(99L)).thenThrow(ResourceNotFoundException.document(99L));

    mockMvc
        .perform(get("/v1/documents/99"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("NOT_FOUND"))
        .andExpect(jsonPath("$.message").value("document not found id=99"));
  }

  @Test
  void listPassesFiltersThrough() throws Exception {
    when(documentRegistryService.list(3L, "PUC", "critical", 30)).thenReturn(List.of(view(1L)));

    mockMvc
        .perform(
            get("/v1/documents")
                .param("machine_id", "3")
                .param("document_type", "PUC")
                .param("status", "critical")
                .param("expiring_within_days", "30"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.count").value(1))
        .andExpect(jsonPath("$.documents[0].id").value(1));
  }

  @Test
  void expiringRejectsNegativeDays() throws Exception {
    mockMvc
        .perform(get("/v1/documents/expiring").param("days", "-1"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("BAD_REQUEST"))
        .andExpect(jsonPath("$.message").value("days must not be negative"));
    verifyNoInteractions(documentRegistryService);
  }

  @Test
  void deleteReturnsNoContent() throws Exception {
    mockMvc.perform(delete("/v1/documents/8")).andExpect(status().isNoContent());
  }

  @Test
  void bulkRenewReturnsUpdatedCount() throws Exception {
    when(documentRegistryService.bulkRenew(
            List.of(1L, 2L), List.of(LocalDate.of(2027, 1, 1)), "batch"))
        .thenReturn(2);
    final String body =
        """
        {
          "document_ids": [1, 2],
          "new_expiry_dates": ["2027-01-01"],
          "remarks": "batch"
        }
        """;

    mockMvc
        .perform(
            post("/v1/documents/bulk-renewal").contentType(MediaType.APPLICATION_JSON).content(body))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.updated_count").value(2));
  }

  private MachineDocumentView view(long id) {
    return new MachineDocumentView(
        id,
        3L,
        "MR-003",
        "Backhoe",
        DocumentType.INSURANCE,
        LocalDate.of(2026, 3, 15),
        null,
        null,
        CREATED_AT,
        CREATED_AT,
        5L,
        ExpiryStatus.WARNING,
        List.of(7, 3));
  }
}
