package com.realchain.escrow.model;

public enum DealRole {
  SELLER,
  BUYER,
  SELLER_OR_BUYER,
  ANYONE
}
