package com.machinerental.compliance.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** document_type は全種別に適用した場合 null。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ConfiguredCountResponse(String documentType, int configuredCount) {}
