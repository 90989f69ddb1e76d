package com.machinerental.compliance.model;

public record UpsertResult(long id, UpsertAction action) {}
