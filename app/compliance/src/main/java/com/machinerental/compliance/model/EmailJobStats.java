package com.machinerental.compliance.model;

public record EmailJobStats(long totalJobs, long completed, long failed, long pending, long last24h) {}
