package com.machinerental.compliance.model;

import java.time.Instant;
import java.time.LocalDate;

public record NotificationLogView(
    long id,
    long documentId,
    String machineNumber,
    String machineName,
    DocumentType documentType,
    int daysBefore,
    LocalDate notificationDate,
    Instant createdAt) {}
