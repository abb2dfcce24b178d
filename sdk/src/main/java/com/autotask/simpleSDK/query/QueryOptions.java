package com.autotask.simpleSDK.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Options for an entity {@code list} call. The filter is either a field map (flat {@code field -> value}
 * equality, or nested {@code field -> {op -> value}}) or a ready-made predicate list; never both.
 */
public final class QueryOptions {
    private static final QueryOptions NONE = new Builder().build();

    private final Map<String, Object> filterMap;
    private final List<FilterPredicate> predicates;
    private final String sort;
    private final Integer page;
    private final Integer pageSize;

    private QueryOptions(Builder builder) {
        this.filterMap = builder.filterMap == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(builder.filterMap));
        this.predicates = builder.predicates == null ? null : List.copyOf(builder.predicates);
        this.sort = builder.sort;
        this.page = builder.page;
        this.pageSize = builder.pageSize;
    }

    public static QueryOptions none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<Map<String, Object>> getFilterMap() {
        return Optional.ofNullable(filterMap);
    }

    public Optional<List<FilterPredicate>> getPredicates() {
        return Optional.ofNullable(predicates);
    }

    public Optional<String> getSort() {
        return Optional.ofNullable(sort);
    }

    public Optional<Integer> getPage() {
        return Optional.ofNullable(page);
    }

    public Optional<Integer> getPageSize() {
        return Optional.ofNullable(pageSize);
    }

    @Override
    public String toString() {
        return "QueryOptions{filter=" + (predicates != null ? predicates : filterMap)
            + ", sort=" + sort + ", page=" + page + ", pageSize=" + pageSize + "}";
    }

    public static class Builder {
        private Map<String, Object> filterMap;
        private List<FilterPredicate> predicates;
        private String sort;
        private Integer page;
        private Integer pageSize;

        /** Adds a flat equality condition, or a nested {@code {op: value}} map for other operators. */
        public Builder where(String field, Object value) {
            if (predicates != null) {
                throw new IllegalStateException("Filter already given as a predicate list");
            }
            if (filterMap == null) {
                filterMap = new LinkedHashMap<>();
            }
            filterMap.put(field, value);
            return this;
        }

        public Builder filter(Map<String, ?> filter) {
            if (predicates != null) {
                throw new IllegalStateException("Filter already given as a predicate list");
            }
            this.filterMap = filter == null ? null : new LinkedHashMap<>(filter);
            return this;
        }

        public Builder filter(List<FilterPredicate> predicates) {
            if (filterMap != null) {
                throw new IllegalStateException("Filter already given as a field map");
            }
            this.predicates = predicates == null ? null : new ArrayList<>(predicates);
            return this;
        }

        public Builder filter(FilterPredicate... predicates) {
            return filter(List.of(predicates));
        }

        public Builder sort(String sort) {
            this.sort = sort;
            return this;
        }

        public Builder page(int page) {
            this.page = page;
            return this;
        }

        public Builder pageSize(int pageSize) {
            this.pageSize = pageSize;
            return this;
        }

        public QueryOptions build() {
            return new QueryOptions(this);
        }
    }
}
