package com.example.stats_client.service;

import java.util.Map;
import org.springframework.util.CollectionUtils;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;

/** pathTemplate は RestClient の URI テンプレート。クエリ値はエンコード前の生値を保持する。 */
public record StatsRoute(
    String pathTemplate,
    Map<String, Object> uriVariables,
    MultiValueMap<String, String> queryParams) {

  public StatsRoute {
    uriVariables = Map.copyOf(uriVariables);
    queryParams = CollectionUtils.unmodifiableMultiValueMap(new LinkedMultiValueMap<>(queryParams));
  }
}
