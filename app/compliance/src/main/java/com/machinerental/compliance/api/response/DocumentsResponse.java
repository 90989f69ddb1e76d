package com.machinerental.compliance.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.machinerental.compliance.model.MachineDocumentView;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DocumentsResponse(int count, List<DocumentResponse> documents) {

  public DocumentsResponse {
    documents = documents == null ? List.of() : List.copyOf(documents);
  }

  public static DocumentsResponse from(List<MachineDocumentView> views) {
    final List<DocumentResponse> documents = views.stream().map(DocumentResponse::from).toList();
    return new DocumentsResponse(documents.size(), documents);
  }
}
