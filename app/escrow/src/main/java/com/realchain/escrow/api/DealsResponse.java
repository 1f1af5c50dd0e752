/*
 * どこで: Escrow API
 * 何を: seller ごとの Deal 一覧レスポンスを表す
 * なぜ: seller と deals を明示的に返すため
 */
package com.realchain.escrow.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DealsResponse(String seller, List<DealResponse> deals) {
  public DealsResponse {
    // SpotBugs の EI_EXPOSE_REP 対応: 受け取ったリストを防御的コピーして不変化する
    if (deals != null) {
      deals = Collections.unmodifiableList(new ArrayList<>(deals));
    }
  }
}
