package com.enterprise.bulkload.shared.valueresolver.adapter;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class DottedPathTest {

    private final Map<String, Object> row = Map.of(
            "contact", Map.of("email", "a@b.c"),
            "tags", List.of("x", Map.of("name", "y")),
            "flat", "text");

    @Test
    void walksMapsAndLists() {
        assertThat(DottedPath.get(row, "contact.email")).isEqualTo("a@b.c");
        assertThat(DottedPath.get(row, "tags.0")).isEqualTo("x");
        assertThat(DottedPath.get(row, "tags.1.name")).isEqualTo("y");
    }

    @Test
    void missingIsNullNeverAnError() {
        assertThat(DottedPath.get(row, "contact.phone")).isNull();
        assertThat(DottedPath.get(row, "flat.deeper")).isNull();
        assertThat(DottedPath.get(row, "tags.9")).isNull();
        assertThat(DottedPath.get(row, "tags.first")).isNull();
        assertThat(DottedPath.get(null, "a")).isNull();
        assertThat(DottedPath.get(row, "")).isNull();
    }

    @Test
    void putCreatesIntermediateMaps() {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("a", "scalar");
        DottedPath.put(root, "a.b.c", 1);
        DottedPath.put(root, "top", 2);
        assertThat(DottedPath.get(root, "a.b.c")).isEqualTo(1);
        assertThat(root).containsEntry("top", 2);
    }

    @Test
    void putKeepsSiblingsOfAnExistingImmutableMap() {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("bulkload", Map.of("table", "customers"));

        DottedPath.put(root, "bulkload.counts.inserted", 3L);

        assertThat(DottedPath.get(root, "bulkload.table")).isEqualTo("customers");
        assertThat(DottedPath.get(root, "bulkload.counts.inserted")).isEqualTo(3L);
    }
}
