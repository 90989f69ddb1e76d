package com.machinerental.compliance.model;

public enum UpsertAction {
  CREATED,
  UPDATED
}
