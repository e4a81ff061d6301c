package com.spiderhub.common.model;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * A single parser call. Each variant knows its positional backend arguments and a
 * canonical signature, so that logically identical calls share one cache key.
 */
public sealed interface Operation
        permits Operation.Home, Operation.Category, Operation.Detail, Operation.Search, Operation.Player {

    OperationType type();

    Object[] arguments();

    String signature();

    default String function() {
        return type().function();
    }

    // sorted copy, so the signature does not depend on insertion order; null keys are dropped
    private static Map<String, String> sortedFilters(Map<String, String> filters) {
        if (filters == null || filters.isEmpty()) return Collections.emptyMap();
        Map<String, String> sorted = new TreeMap<>();
        filters.forEach((k, v) -> {
            if (k != null) sorted.put(k, v == null ? "" : v);
        });
        return Collections.unmodifiableMap(sorted);
    }

    private static List<String> withoutNulls(List<String> values) {
        if (values == null) return List.of();
        return values.stream().filter(Objects::nonNull).toList();
    }

    record Home(boolean filter) implements Operation {
        @Override
        public OperationType type() { return OperationType.HOME; }

        @Override
        public Object[] arguments() { return new Object[] { filter }; }

        @Override
        public String signature() { return filter ? "f" : "-"; }
    }

    record Category(String typeId, int page, boolean filter, Map<String, String> filters) implements Operation {
        public Category {
            typeId = typeId == null ? "" : typeId;
            page = Math.max(1, page);
            filters = sortedFilters(filters);
        }

        @Override
        public OperationType type() { return OperationType.CATEGORY; }

        @Override
        public Object[] arguments() {
            return new Object[] { typeId, String.valueOf(page), filter, filters };
        }

        @Override
        public String signature() {
            String f = filters.entrySet().stream()
                    .map(e -> e.getKey() + "=" + e.getValue())
                    .collect(Collectors.joining("&"));
            return typeId + "|" + page + "|" + (filter ? "f" : "-") + "|" + f;
        }

        public Category withPage(int newPage) {
            return new Category(typeId, newPage, filter, filters);
        }
    }

    record Detail(List<String> ids) implements Operation {
        public Detail {
            ids = withoutNulls(ids);
        }

        @Override
        public OperationType type() { return OperationType.DETAIL; }

        @Override
        public Object[] arguments() { return new Object[] { ids }; }

        @Override
        public String signature() { return String.join(",", ids); }
    }

    record Search(String keyword, boolean quick) implements Operation {
        public Search {
            keyword = keyword == null ? "" : keyword.trim();
        }

        @Override
        public OperationType type() { return OperationType.SEARCH; }

        @Override
        public Object[] arguments() { return new Object[] { keyword, quick }; }

        @Override
        public String signature() {
            return keyword.toLowerCase(Locale.ROOT) + "|" + (quick ? "q" : "-");
        }
    }

    record Player(String flag, String id, List<String> vipFlags) implements Operation {
        public Player {
            flag = flag == null ? "" : flag;
            id = id == null ? "" : id;
            vipFlags = withoutNulls(vipFlags);
        }

        @Override
        public OperationType type() { return OperationType.PLAYER; }

        @Override
        public Object[] arguments() { return new Object[] { flag, id, vipFlags }; }

        @Override
        public String signature() { return flag + "|" + id; }
    }
}
