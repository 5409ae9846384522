package com.jobprospector.hiring.detection.search;

import com.jobprospector.hiring.detection.model.SearchHit;

import java.util.List;

public interface WebSearchClient {
    List<SearchHit> search(String query, int numResults);

    boolean isConfigured();
}
