package com.realchain.escrow.model;

// create_listing の price/property_hash と、confirm_transfer の任意 property_hash を運ぶ。
public record DealArguments(Long price, String propertyHash) {

  public static DealArguments none() {
    return new DealArguments(null, null);
  }
}
