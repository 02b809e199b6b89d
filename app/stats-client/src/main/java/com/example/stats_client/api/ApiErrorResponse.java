/*
 * どこで: Stats API
 * 何を: エラー応答の標準フォーマットを定義する
 * なぜ: 上流失敗と入力不正を同じ形で返し、呼び出し側が code で分岐できるようにするため
 */
package com.example.stats_client.api;

public record ApiErrorResponse(String code, String message) {}
