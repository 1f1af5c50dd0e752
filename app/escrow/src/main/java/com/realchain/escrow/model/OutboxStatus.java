package com.realchain.escrow.model;

// outbox_events.status の CHECK 制約と同じ値を持つ。
public enum OutboxStatus {
  PENDING,
  IN_FLIGHT,
  PUBLISHED,
  FAILED
}
