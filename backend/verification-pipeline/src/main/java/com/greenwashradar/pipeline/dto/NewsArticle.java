package com.greenwashradar.pipeline.dto;

public record NewsArticle(String url, String title, String snippet, String publishedAt) {
}
