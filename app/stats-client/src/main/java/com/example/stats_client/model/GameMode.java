/*
 * どこで: Stats ドメインモデル
 * 何を: 上流 API がサポートするゲームモードを定義する
 * なぜ: ルーティングとページ文脈で mode の表記を固定するため
 */
package com.example.stats_client.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum GameMode {
  OSU("osu"),
  TAIKO("taiko"),
  FRUITS("fruits"),
  MANIA("mania");

  private final String value;

  GameMode(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  /**
   * 役割: パス変数や JSON の mode 文字列を内部列挙型へ変換する。
   * 動作: 大文字小文字を無視して一致判定を行い、未対応値は IllegalArgumentException を送出する。
   */
  @JsonCreator
  public static GameMode fromValue(String mode) {
    for (GameMode gameMode : values()) {
      if (gameMode.value.equalsIgnoreCase(mode)) {
        return gameMode;
      }
    }
    throw new IllegalArgumentException("unsupported mode: " + mode);
  }
}
