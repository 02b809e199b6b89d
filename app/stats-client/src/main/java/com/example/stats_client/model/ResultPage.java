/*
 * どこで: Stats ドメインモデル
 * 何を: 取得済み 1 ページの共通ビューを定義する
 * なぜ: カーソル方式が異なるページ型を、件数と継続有無だけで横断的に扱うため
 */
package com.example.stats_client.model;

import java.util.List;

public interface ResultPage<T> {

  List<T> items();

  /** false のとき次ページ取得は transport を呼ばずに終端を返す。 */
  boolean hasMore();
}
