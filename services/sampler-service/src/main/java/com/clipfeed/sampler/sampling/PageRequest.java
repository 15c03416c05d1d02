package com.clipfeed.sampler.sampling;

import java.util.LinkedHashMap;
import java.util.Map;

public final class PageRequest {
    private final int page;
    private final int perPage;
    private final String sort;
    private final String searchTerm;

    public PageRequest(int page, int perPage, String sort, String searchTerm) {
        this.page = Math.max(1, page);
        this.perPage = Math.max(1, perPage);
        this.sort = sort;
        this.searchTerm = searchTerm;
    }

    public static PageRequest countOnly(String searchTerm) {
        return new PageRequest(1, 1, null, searchTerm);
    }

    public PageRequest withPage(int newPage) {
        return new PageRequest(newPage, perPage, sort, searchTerm);
    }

    public Map<String, Object> toFindFilter() {
        Map<String, Object> filter = new LinkedHashMap<>();
        filter.put("page", page);
        filter.put("per_page", perPage);
        if (sort != null && !sort.isBlank()) {
            filter.put("sort", sort);
            filter.put("direction", "ASC");
        }
        if (searchTerm != null && !searchTerm.isBlank()) {
            filter.put("q", searchTerm);
        }
        return filter;
    }

    public int getPage() {
        return page;
    }

    public int getPerPage() {
        return perPage;
    }

    public String getSort() {
        return sort;
    }

    public String getSearchTerm() {
        return searchTerm;
    }

    @Override
    public String toString() {
        return "PageRequest{page=" + page + ", perPage=" + perPage + ", sort=" + sort + "}";
    }
}
