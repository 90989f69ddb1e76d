package com.machinerental.compliance.model;

public record MachineRecord(long id, String machineNumber, String name, boolean active) {}
