package com.realchain.escrow.model;

public enum TransferKind {
  // buyer -> custodian
  DEPOSIT,
  // custodian -> seller
  PAYOUT,
  // custodian -> buyer
  REFUND
}
