package com.openstable.sync.merge;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link CacheMerge} - upsert semantics, key uniqueness, order preservation and paging.
 */
class CacheMergeTest {

    record Item(String id, String name, String group, Instant updatedAt) {
    }

    private static final Item A = new Item("a", "Alpha box", "north", Instant.parse("2026-01-01T10:00:00Z"));
    private static final Item B = new Item("b", "Beta box", "south", Instant.parse("2026-01-03T10:00:00Z"));
    private static final Item C = new Item("c", "Gamma stall", "north", Instant.parse("2026-01-02T10:00:00Z"));

    @Nested
    @DisplayName("mergeData")
    class MergeData {

        @Test
        @DisplayName("replaces matching keys in place and appends new keys")
        void mergeData_upsertsPreservingOrder() {
            Item renamedA = new Item("a", "Alpha renamed", "north", A.updatedAt());

            List<Item> merged = CacheMerge.mergeData(List.of(A, B), List.of(C, renamedA), Item::id);

            assertThat(merged).containsExactly(renamedA, B, C);
        }

        @Test
        @DisplayName("applying the same batch twice gives the same result")
        void mergeData_idempotent() {
            List<Item> once = CacheMerge.mergeData(List.of(A), List.of(B, C), Item::id);
            List<Item> twice = CacheMerge.mergeData(once, List.of(B, C), Item::id);

            assertThat(twice).isEqualTo(once);
        }

        @Test
        @DisplayName("duplicate keys in incoming collapse to the last value")
        void mergeData_lastIncomingWins() {
            Item firstB = new Item("b", "first", "x", null);
            Item lastB = new Item("b", "last", "x", null);

            List<Item> merged = CacheMerge.mergeData(List.of(), List.of(firstB, lastB), Item::id);

            assertThat(merged).containsExactly(lastB);
        }

        @Test
        @DisplayName("does not modify its input")
        void mergeData_inputUntouched() {
            List<Item> existing = new ArrayList<>(List.of(A));

            List<Item> merged = CacheMerge.mergeData(existing, List.of(B), Item::id);

            assertThat(existing).containsExactly(A);
            assertThat(merged).isNotSameAs(existing);
        }
    }

    @Test
    @DisplayName("removeData: drops the given keys, ignores unknown keys")
    void removeData_dropsKeys() {
        List<Item> remaining = CacheMerge.removeData(List.of(A, B, C), List.of("b", "zzz"), Item::id);

        assertThat(remaining).containsExactly(A, C);
    }

    @Test
    @DisplayName("updateData: patches the matching entity and leaves others untouched")
    void updateData_patchesMatch() {
        List<Item> updated = CacheMerge.updateData(List.of(A, B), "b",
                item -> new Item(item.id(), "Beta renamed", item.group(), item.updatedAt()), Item::id);

        assertThat(updated).extracting(Item::name).containsExactly("Alpha box", "Beta renamed");
    }

    @Test
    @DisplayName("updateData: no match returns equal content")
    void updateData_noMatch() {
        List<Item> updated = CacheMerge.updateData(List.of(A, B), "zzz", item -> C, Item::id);

        assertThat(updated).containsExactly(A, B);
    }

    @Test
    @DisplayName("findByKey: finds present key, empty for missing key")
    void findByKey() {
        assertThat(CacheMerge.findByKey(List.of(A, B), "b", Item::id)).contains(B);
        assertThat(CacheMerge.findByKey(List.of(A, B), "c", Item::id)).isEmpty();
    }

    @Test
    @DisplayName("sortByTimestamp: newest first by default, missing timestamps last, stable for ties")
    void sortByTimestamp_descending() {
        Item undated = new Item("d", "Delta", "east", null);
        Item tieWithA = new Item("e", "Echo", "east", A.updatedAt());

        List<Item> sorted = CacheMerge.sortByTimestamp(List.of(undated, A, B, tieWithA, C), Item::updatedAt, false);

        assertThat(sorted).extracting(Item::id).containsExactly("b", "c", "a", "e", "d");
        assertThat(CacheMerge.sortByTimestamp(List.of(B, A, C), Item::updatedAt, true))
                .extracting(Item::id).containsExactly("a", "c", "b");
    }

    @Test
    @DisplayName("filterBySearch: case-insensitive substring over the given fields, blank term keeps all")
    void filterBySearch() {
        assertThat(CacheMerge.filterBySearch(List.of(A, B, C), "BOX", Item::name)).containsExactly(A, B);
        assertThat(CacheMerge.filterBySearch(List.of(A, B, C), "south", Item::name, Item::group)).containsExactly(B);
        assertThat(CacheMerge.filterBySearch(List.of(A, B, C), "  ", Item::name)).containsExactly(A, B, C);
    }

    @Test
    @DisplayName("groupBy: groups keep first-seen order")
    void groupBy_preservesOrder() {
        Map<String, List<Item>> groups = CacheMerge.groupBy(List.of(A, B, C), Item::group);

        assertThat(groups).containsOnlyKeys("north", "south");
        assertThat(groups.keySet()).containsExactly("north", "south");
        assertThat(groups.get("north")).containsExactly(A, C);
    }

    @Nested
    @DisplayName("paginate")
    class Paginate {

        private final List<Integer> numbers = List.of(1, 2, 3, 4, 5, 6, 7);

        @Test
        @DisplayName("middle page has next and previous")
        void paginate_middlePage() {
            Page<Integer> page = CacheMerge.paginate(numbers, 2, 3);

            assertThat(page.items()).containsExactly(4, 5, 6);
            assertThat(page.totalPages()).isEqualTo(3);
            assertThat(page.totalItems()).isEqualTo(7);
            assertThat(page.hasNext()).isTrue();
            assertThat(page.hasPrev()).isTrue();
        }

        @Test
        @DisplayName("last page is partial and has no next")
        void paginate_lastPage() {
            Page<Integer> page = CacheMerge.paginate(numbers, 3, 3);

            assertThat(page.items()).containsExactly(7);
            assertThat(page.hasNext()).isFalse();
        }

        @Test
        @DisplayName("out-of-range page is empty")
        void paginate_outOfRange() {
            assertThat(CacheMerge.paginate(numbers, 4, 3).items()).isEmpty();
            assertThat(CacheMerge.paginate(numbers, 0, 3).items()).isEmpty();
            assertThat(CacheMerge.paginate(List.<Integer>of(), 1, 3).totalPages()).isZero();
        }

        @Test
        @DisplayName("non-positive page size is rejected")
        void paginate_invalidPageSize() {
            assertThatThrownBy(() -> CacheMerge.paginate(numbers, 1, 0))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
