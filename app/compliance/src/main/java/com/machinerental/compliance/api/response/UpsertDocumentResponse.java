package com.machinerental.compliance.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.machinerental.compliance.model.UpsertAction;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record UpsertDocumentResponse(long id, UpsertAction action) {}
