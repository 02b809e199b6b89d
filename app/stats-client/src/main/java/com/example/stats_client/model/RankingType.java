/*
 * どこで: Stats ドメインモデル
 * 何を: rankings エンドポイントの種別セグメントを定義する
 * なぜ: ルーティングで使う {type} の表記を一箇所に固定するため
 */
package com.example.stats_client.model;

public enum RankingType {
  CHARTS("charts"),
  COUNTRY("country"),
  PERFORMANCE("performance"),
  SCORE("score");

  private final String value;

  RankingType(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }
}
