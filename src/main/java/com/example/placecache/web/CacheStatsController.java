package com.example.placecache.web;

import com.example.placecache.service.CacheStatsService;
import com.example.placecache.util.CacheStats;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/cache")
@RequiredArgsConstructor
public class CacheStatsController {
  private final CacheStatsService cacheStatsService;

  @GetMapping("/stats")
  public CacheStats stats() {
    return cacheStatsService.snapshot();
  }
}
