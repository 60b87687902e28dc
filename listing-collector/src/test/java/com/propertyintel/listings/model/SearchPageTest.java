package com.propertyintel.listings.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SearchPageTest {

    @Test
    void searchPageToleratesMissingFields() {
        SearchPage page = SearchPage.fromPayload(Map.of("elementList", List.of(Map.of("propertyCode", "1"), "junk")));

        assertThat(page.totalPages()).isEqualTo(1);
        assertThat(page.elements()).hasSize(1);
        assertThat(SearchPage.fromPayload(null).isEmpty()).isTrue();
        assertThat(SearchPage.fromPayload(Map.of("totalPages", "4")).totalPages()).isEqualTo(4);
    }
}
