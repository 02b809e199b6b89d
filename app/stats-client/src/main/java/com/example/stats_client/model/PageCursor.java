/*
 * どこで: Stats ドメインモデル
 * 何を: ページ番号方式カーソルの正規形 (None / PageNumber) を定義する
 * なぜ: ワイヤ上の 3 形式 (null / 整数 / {"page": n}) の違いを下流へ漏らさないため
 */
package com.example.stats_client.model;

import java.util.OptionalInt;

public sealed interface PageCursor permits PageCursor.None, PageCursor.PageNumber {

  static PageCursor none() {
    return None.INSTANCE;
  }

  static PageCursor page(int page) {
    return new PageNumber(page);
  }

  /** None のときに限り false。 */
  boolean hasNext();

  OptionalInt pageNumber();

  enum None implements PageCursor {
    INSTANCE;

    @Override
    public boolean hasNext() {
      return false;
    }

    @Override
    public OptionalInt pageNumber() {
      return OptionalInt.empty();
    }
  }

  record PageNumber(int page) implements PageCursor {

    public PageNumber {
      if (page < 0) {
        throw new IllegalArgumentException("page must not be negative");
      }
    }

    @Override
    public boolean hasNext() {
      return true;
    }

    @Override
    public OptionalInt pageNumber() {
      return OptionalInt.of(page);
    }
  }
}
