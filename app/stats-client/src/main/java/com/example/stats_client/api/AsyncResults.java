package com.example.stats_client.api;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/** 非同期結果を待ち合わせ、CompletionException を剥がして元の例外を例外ハンドラへ渡す。 */
final class AsyncResults {

  private AsyncResults() {}

  static <T> T await(CompletableFuture<T> future) {
    try {
      return future.join();
    } catch (CompletionException ex) {
      if (ex.getCause() instanceof RuntimeException cause) {
        throw cause;
      }
      throw ex;
    }
  }
}
