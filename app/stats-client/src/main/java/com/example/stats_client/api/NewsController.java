package com.example.stats_client.api;

import com.example.stats_client.api.response.NewsListResponse;
import com.example.stats_client.model.NewsPage;
import com.example.stats_client.service.PaginationService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/news")
@RequiredArgsConstructor
public class NewsController {

  private final PaginationService paginationService;

  @GetMapping
  public ResponseEntity<NewsListResponse> news(
      @RequestParam(name = "pages", defaultValue = "1") int pages) {
    final NewsPage page = AsyncResults.await(paginationService.news(pages));
    return ResponseEntity.ok(new NewsListResponse(page.posts(), page.hasMore()));
  }
}
