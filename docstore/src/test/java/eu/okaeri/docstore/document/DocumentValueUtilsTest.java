package eu.okaeri.docstore.document;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class DocumentValueUtilsTest {

    @Nested
    class PathAccess {

        @Test
        void extracts_nested_value() {
            Map<String, Object> map = Map.of("photo_requirements", Map.of("size", "35x45"));
            assertThat(DocumentValueUtils.extractValue(map, DocumentValueUtils.toParts("photo_requirements.size"))).isEqualTo("35x45");
        }

        @Test
        void returns_null_when_navigating_through_non_map() {
            Map<String, Object> map = Map.of("name", "Japan");
            assertThat(DocumentValueUtils.extractValue(map, List.of("name", "length"))).isNull();
        }

        @Test
        void present_null_counts_as_present() {
            Map<String, Object> map = new HashMap<>();
            map.put("capital", null);
            assertThat(DocumentValueUtils.hasPath(map, List.of("capital"))).isTrue();
            assertThat(DocumentValueUtils.hasPath(map, List.of("currency"))).isFalse();
        }
    }

    @Nested
    class ValueEquals {

        @Test
        void numbers_compare_by_value_across_types() {
            assertThat(DocumentValueUtils.valueEquals(1, 1L)).isTrue();
            assertThat(DocumentValueUtils.valueEquals(1, 1.0)).isTrue();
            assertThat(DocumentValueUtils.valueEquals(1, 1.5)).isFalse();
        }

        @Test
        void lists_and_maps_compare_deeply() {
            assertThat(DocumentValueUtils.valueEquals(Arrays.asList(1, "a"), Arrays.asList(1L, "a"))).isTrue();
            assertThat(DocumentValueUtils.valueEquals(Map.of("a", List.of(1)), Map.of("a", List.of(1.0)))).isTrue();
            assertThat(DocumentValueUtils.valueEquals(List.of(1, 2), List.of(2, 1))).isFalse();
        }

        @Test
        void null_only_equals_null() {
            assertThat(DocumentValueUtils.valueEquals(null, null)).isTrue();
            assertThat(DocumentValueUtils.valueEquals(null, "")).isFalse();
        }

        @Test
        void equal_values_hash_equally() {
            assertThat(DocumentValueUtils.valueHash(-0.0)).isEqualTo(DocumentValueUtils.valueHash(0.0));
            assertThat(DocumentValueUtils.valueHash(1)).isEqualTo(DocumentValueUtils.valueHash(1.0));
            assertThat(DocumentValueUtils.valueHash(Map.of("size", 1)))
                .isEqualTo(DocumentValueUtils.valueHash(Map.of("size", 1.0)));
            assertThat(DocumentValueUtils.valueHash(List.of(2L, Map.of("k", 3))))
                .isEqualTo(DocumentValueUtils.valueHash(List.of(2.0, Map.of("k", 3.0f))));
        }

        @Test
        void nan_does_not_break_comparison() {
            assertThat(DocumentValueUtils.valueEquals(Double.NaN, 1)).isFalse();
        }
    }

    @Nested
    class CompareForSort {

        @Test
        void null_sorts_before_every_value() {
            assertThat(DocumentValueUtils.compareForSort(null, "")).isNegative();
            assertThat(DocumentValueUtils.compareForSort(null, -5)).isNegative();
            assertThat(DocumentValueUtils.compareForSort(false, null)).isPositive();
            assertThat(DocumentValueUtils.compareForSort(null, null)).isZero();
        }

        @Test
        void zero_value_follows_reference_type() {
            assertThat(DocumentValueUtils.zeroValueLike("a")).isEqualTo("");
            assertThat(DocumentValueUtils.zeroValueLike(5L)).isEqualTo(0);
            assertThat(DocumentValueUtils.zeroValueLike(true)).isEqualTo(false);
            assertThat(DocumentValueUtils.zeroValueLike(List.of(1))).isNull();
        }

        @Test
        void order_is_total_over_mixed_types() {
            List<Object> values = Arrays.asList(null, 0L, "", 1L, "a", -1L, "b", 2L, 0.0, true, UUID.randomUUID(), Map.of("k", 1));
            Random random = new Random(42);

            for (int round = 0; round < 200; round++) {
                List<Object> shuffled = new ArrayList<>();
                for (int i = 0; i < 64; i++) {
                    shuffled.add(values.get(random.nextInt(values.size())));
                }
                shuffled.sort(DocumentValueUtils::compareForSort);
                assertThat(shuffled).isSortedAccordingTo(DocumentValueUtils::compareForSort);
            }
        }

        @Test
        void unknown_types_order_by_class_then_value() {
            UUID low = new UUID(0, 1);
            UUID high = new UUID(0, 2);
            Object other = new char[]{'x'};

            assertThat(DocumentValueUtils.compareForSort(low, high)).isNegative();
            assertThat(Integer.signum(DocumentValueUtils.compareForSort(other, low)))
                .isEqualTo(-Integer.signum(DocumentValueUtils.compareForSort(low, other)))
                .isNotZero();
        }

        @Test
        void different_types_order_by_rank() {
            List<Object> values = new ArrayList<>(Arrays.asList(true, List.of(1), "b", Map.of("k", 1), 3));
            values.sort(DocumentValueUtils::compareForSort);
            assertThat(values).containsExactly(3, "b", Map.of("k", 1), List.of(1), true);
        }

        @Test
        void numbers_compare_numerically() {
            assertThat(DocumentValueUtils.compareForSort(2, 10L)).isNegative();
            assertThat(DocumentValueUtils.compareForSort(2.5, 2)).isPositive();
        }
    }
}
