package com.realchain.escrow.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.realchain.escrow.model.BundleTransaction;
import com.realchain.escrow.model.DealAction;
import com.realchain.escrow.model.DealArguments;
import com.realchain.escrow.model.DealCommand;
import com.realchain.escrow.model.TransactionBundle;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class RequestHasherTest {

  private static final UUID DEAL_ID = UUID.fromString("7d1f8a64-4c1e-4f39-9d43-0c6a9e3a2b11");

  private final RequestHasher hasher = new RequestHasher(new ObjectMapper());

  @Test
  void hashIsStableForEqualCommands() {
    assertThat(hasher.hash(offer("buyer", 1000L))).isEqualTo(hasher.hash(offer("buyer", 1000L)));
    assertThat(hasher.hash(offer("buyer", 1000L))).hasSize(64);
  }

  @Test
  void hashChangesWithCallerOrBundle() {
    final String base = hasher.hash(offer("buyer", 1000L));

    assertThat(hasher.hash(offer("other", 1000L))).isNotEqualTo(base);
    assertThat(hasher.hash(offer("buyer", 999L))).isNotEqualTo(base);
  }

  @Test
  void hashChangesWithArguments() {
    final DealCommand first =
        new DealCommand(
            DealAction.CREATE_LISTING, null, "seller", new DealArguments(1000L, "h1"), null);
    final DealCommand second =
        new DealCommand(
            DealAction.CREATE_LISTING, null, "seller", new DealArguments(1000L, "h2"), null);

    assertThat(hasher.hash(first)).isNotEqualTo(hasher.hash(second));
  }

  private DealCommand offer(String caller, long amount) {
    return new DealCommand(
        DealAction.MAKE_OFFER,
        DEAL_ID,
        caller,
        null,
        TransactionBundle.of(
            BundleTransaction.payment(caller, "escrow-custodian-" + DEAL_ID, amount),
            BundleTransaction.appCall(caller, "make_offer")));
  }
}
