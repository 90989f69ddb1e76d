package com.machinerental.compliance.model;

public record NotificationRuleRecord(long documentId, int daysBefore, boolean active) {}
