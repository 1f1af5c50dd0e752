package com.realchain.escrow.model;

public enum StateValueType {
  BYTES,
  UINT
}
