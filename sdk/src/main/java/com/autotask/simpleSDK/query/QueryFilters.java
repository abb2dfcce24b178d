package com.autotask.simpleSDK.query;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns {@link QueryOptions} into the body of a {@code POST {endpoint}/query} call.
 */
public final class QueryFilters {
    public static final String FILTER = "filter";
    public static final String SORT = "sort";
    public static final String PAGE = "page";
    public static final String MAX_RECORDS = "MaxRecords";

    private QueryFilters() {
    }

    /**
     * Normalizes the filter of {@code options} to a predicate list.
     * <ul>
     *   <li>no filter, or an empty one: the match-all predicate {@code {op: gte, field: id, value: 0}}</li>
     *   <li>predicate list: returned as given</li>
     *   <li>{@code field -> value}: {@code {op: eq, field, value}}, in key order</li>
     *   <li>{@code field -> {op -> value}}: one {@code {op, field, value}} per operator entry</li>
     * </ul>
     */
    public static List<FilterPredicate> normalize(QueryOptions options) {
        QueryOptions query = options == null ? QueryOptions.none() : options;

        if (query.getPredicates().isPresent()) {
            List<FilterPredicate> predicates = query.getPredicates().get();
            return predicates.isEmpty() ? List.of(FilterPredicate.matchAll()) : predicates;
        }

        Map<String, Object> filter = query.getFilterMap().orElse(Map.of());
        if (filter.isEmpty()) {
            return List.of(FilterPredicate.matchAll());
        }

        List<FilterPredicate> predicates = new ArrayList<>();
        for (Map.Entry<String, Object> entry : filter.entrySet()) {
            Object value = entry.getValue();
            if (value instanceof Map && !((Map<?, ?>) value).isEmpty()) {
                for (Map.Entry<?, ?> operator : ((Map<?, ?>) value).entrySet()) {
                    predicates.add(FilterPredicate.of(String.valueOf(operator.getKey()), entry.getKey(), operator.getValue()));
                }
            } else {
                predicates.add(FilterPredicate.eq(entry.getKey(), value));
            }
        }
        return predicates;
    }

    /**
     * Builds {@code {filter, sort?, page?, MaxRecords?}}. Sort is sent when non-blank, page and page size
     * when positive.
     */
    public static Map<String, Object> searchBody(QueryOptions options) {
        QueryOptions query = options == null ? QueryOptions.none() : options;

        Map<String, Object> body = new LinkedHashMap<>();
        body.put(FILTER, normalize(query));
        query.getSort().filter(sort -> !sort.isBlank()).ifPresent(sort -> body.put(SORT, sort));
        query.getPage().filter(page -> page > 0).ifPresent(page -> body.put(PAGE, page));
        query.getPageSize().filter(size -> size > 0).ifPresent(size -> body.put(MAX_RECORDS, size));
        return body;
    }
}
