/*
 * どこで: Stats コーデック層
 * 何を: 上流応答の構造不備 (必須キー欠落 / 型不一致) を表現する
 * なぜ: API 層と呼び出し元がどのキーで失敗したかを判別できるようにするため
 */
package com.example.stats_client.codec;

public class StatsDecodeException extends RuntimeException {

  public enum Reason {
    MISSING_FIELD,
    TYPE_MISMATCH
  }

  private final Reason reason;
  private final String field;

  public StatsDecodeException(Reason reason, String field, String message) {
    super(message);
    this.reason = reason;
    this.field = field;
  }

  public StatsDecodeException(Reason reason, String field, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
    this.field = field;
  }

  public static StatsDecodeException missingField(String field) {
    return new StatsDecodeException(Reason.MISSING_FIELD, field, "missing field `" + field + "`");
  }

  public static StatsDecodeException typeMismatch(String field, String message) {
    return new StatsDecodeException(
        Reason.TYPE_MISMATCH, field, "invalid type for `" + field + "`: " + message);
  }

  public static StatsDecodeException typeMismatch(String field, Throwable cause) {
    return new StatsDecodeException(
        Reason.TYPE_MISMATCH,
        field,
        "invalid type for `" + field + "`: " + cause.getMessage(),
        cause);
  }

  public Reason reason() {
    return reason;
  }

  public String field() {
    return field;
  }
}
