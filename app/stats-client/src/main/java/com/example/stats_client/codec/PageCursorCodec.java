/*
 * どこで: Stats コーデック層
 * 何を: ページ番号方式カーソルの 3 形式 (欠落/null, 整数, {"page": n}) を PageCursor へ変換する
 * なぜ: どのワイヤ形式から来たかを下流へ漏らさず、正規形 2 ケースだけを扱わせるため
 */
package com.example.stats_client.codec;

import com.example.common.json.JsonFields;
import com.example.stats_client.model.PageCursor;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

/** 不透明カーソルはこのクラスを通さない。OpaqueCursor がそのまま保持する。 */
@Component
public class PageCursorCodec {

  static final String CURSOR = "cursor";
  private static final String PAGE = "page";

  public PageCursor decode(JsonNode cursor) {
    if (JsonFields.isAbsentOrNull(cursor)) {
      return PageCursor.none();
    }
    if (cursor.isNumber()) {
      return PageCursor.page(toPage(cursor, CURSOR));
    }
    if (cursor.isObject()) {
      final JsonNode page = cursor.get(PAGE);
      if (JsonFields.isAbsent(page)) {
        throw StatsDecodeException.missingField(PAGE);
      }
      if (!page.isNumber()) {
        throw StatsDecodeException.typeMismatch(PAGE, "expected a non-negative integer");
      }
      return PageCursor.page(toPage(page, PAGE));
    }
    throw StatsDecodeException.typeMismatch(
        CURSOR, "expected null, an integer or an object with `page` but was " + cursor.getNodeType());
  }

  /** None はキー自体を出力しない。PageNumber は常に整数形式で書き出す。 */
  public void write(ObjectNode target, String field, PageCursor cursor) {
    cursor.pageNumber().ifPresent(page -> target.put(field, page));
  }

  // 上流は u32 だが int の範囲 (0..Integer.MAX_VALUE) に収まらないページ番号は受け付けない
  private int toPage(JsonNode number, String field) {
    if (!number.isIntegralNumber() || !number.canConvertToInt() || number.intValue() < 0) {
      throw StatsDecodeException.typeMismatch(
          field, "expected a non-negative integer but was " + number.asText());
    }
    return number.intValue();
  }
}
