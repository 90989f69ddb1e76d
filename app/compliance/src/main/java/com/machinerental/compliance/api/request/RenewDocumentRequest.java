package com.machinerental.compliance.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotNull;
import java.time.LocalDate;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RenewDocumentRequest(
    @NotNull(message = "new_expiry_date is required") LocalDate newExpiryDate, String remarks) {}
