package com.greenwashradar.pipeline.fetcher;

import com.greenwashradar.pipeline.dto.NewsArticle;

import java.util.List;

/**
 * Runs one news search query. An empty list means the query matched nothing.
 */
public interface NewsFetcher extends SourceFetcher<String, List<NewsArticle>> {
}
