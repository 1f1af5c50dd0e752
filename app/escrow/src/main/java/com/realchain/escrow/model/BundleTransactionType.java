package com.realchain.escrow.model;

public enum BundleTransactionType {
  PAYMENT,
  APP_CALL
}
