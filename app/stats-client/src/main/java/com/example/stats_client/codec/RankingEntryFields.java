/*
 * どこで: Stats コーデック層
 * 何を: ランキング 1 件のトップレベルキーを一時的に受け止める部分構造
 * なぜ: 収集 (キーごとの格納) と確定 (必須チェックと組み立て) を 2 段階に分けるため
 */
package com.example.stats_client.codec;

import com.example.stats_client.model.GradeCounts;
import com.example.stats_client.model.UserCompact;
import com.example.stats_client.model.UserLevel;
import com.example.stats_client.model.UserStatistics;

/**
 * 各スロットは null のとき「キー未出現」を表す。
 * play_time / pp の明示的 null はデコーダ側で 0 に置き換えてから格納されるため、
 * ここで null のまま残るのはキー自体が無かった場合だけ。
 */
final class RankingEntryFields {

  private Double hitAccuracy;
  private Integer countryRank;
  private Integer globalRank;
  private GradeCounts gradeCounts;
  private Boolean isRanked;
  private UserLevel level;
  private Integer maximumCombo;
  private Integer playCount;
  private Long playTime;
  private Double pp;
  private Long rankedScore;
  private Integer replaysWatchedByOthers;
  private Long totalHits;
  private Long totalScore;
  private UserCompact user;

  void hitAccuracy(double value) {
    hitAccuracy = value;
  }

  void countryRank(Integer value) {
    countryRank = value;
  }

  void globalRank(Integer value) {
    globalRank = value;
  }

  void gradeCounts(GradeCounts value) {
    gradeCounts = value;
  }

  void isRanked(boolean value) {
    isRanked = value;
  }

  void level(UserLevel value) {
    level = value;
  }

  void maximumCombo(int value) {
    maximumCombo = value;
  }

  void playCount(int value) {
    playCount = value;
  }

  void playTime(long value) {
    playTime = value;
  }

  void pp(double value) {
    pp = value;
  }

  void rankedScore(long value) {
    rankedScore = value;
  }

  void replaysWatchedByOthers(int value) {
    replaysWatchedByOthers = value;
  }

  void totalHits(long value) {
    totalHits = value;
  }

  void totalScore(long value) {
    totalScore = value;
  }

  void user(UserCompact value) {
    user = value;
  }

  /**
   * 役割: 収集済みスロットを検証し、statistics を埋め込んだ UserCompact を返す。
   * 動作: 必須スロットを固定順に確認し、最初に欠けていたキー名で MISSING_FIELD を送出する。
   */
  UserCompact build() {
    final double accuracy = require(hitAccuracy, "hit_accuracy");
    final GradeCounts grades = require(gradeCounts, "grade_counts");
    final boolean ranked = require(isRanked, "is_ranked");
    final UserLevel userLevel = require(level, "level");
    final int maxCombo = require(maximumCombo, "maximum_combo");
    final int plays = require(playCount, "play_count");
    final long time = require(playTime, "play_time");
    final double performance = require(pp, "pp");
    final long score = require(rankedScore, "ranked_score");
    final int replays = require(replaysWatchedByOthers, "replays_watched_by_others");
    final long hits = require(totalHits, "total_hits");
    final long total = require(totalScore, "total_score");
    final UserCompact profile = require(user, "user");

    final UserStatistics statistics =
        new UserStatistics(
            accuracy,
            countryRank,
            globalRank,
            grades,
            ranked,
            userLevel,
            maxCombo,
            plays,
            time,
            performance,
            score,
            replays,
            hits,
            total);
    return profile.withStatistics(statistics);
  }

  private static <T> T require(T value, String field) {
    if (value == null) {
      throw StatsDecodeException.missingField(field);
    }
    return value;
  }
}
