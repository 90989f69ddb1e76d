package com.machinerental.compliance.model;

public record DocumentStats(
    long totalDocuments,
    long expiredDocuments,
    long expiringThisWeek,
    long expiringThisMonth,
    long averageDaysUntilExpiry) {}
