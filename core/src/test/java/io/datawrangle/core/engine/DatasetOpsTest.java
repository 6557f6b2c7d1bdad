package io.datawrangle.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.datawrangle.core.engine.jslt.JsltExpressionEngine;
import io.datawrangle.core.model.Dataset;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class DatasetOpsTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    private static Dataset orders() {
        return Dataset.builder(List.of("id", "customer", "total"))
                .addValues(1, "c1", 20)
                .addValues(2, "c2", 5)
                .addValues(3, "c1", null)
                .addValues(4, "c3", 12.5)
                .build();
    }

    private static Dataset customers() {
        return Dataset.builder(List.of("customer", "name"))
                .addValues("c1", "Ada")
                .addValues("c2", "Grace")
                .addValues("c9", "Nobody")
                .build();
    }

    private static List<String> texts(Dataset dataset, String column) {
        return dataset.column(column).stream().map(JsonNode::asText).toList();
    }

    @Nested
    class Projection {

        @Test
        void columnsThenNotColumns() throws Exception {
            Dataset result =
                    DatasetOps.project(orders(), JSON.readTree("[\"id\", \"customer\", \"total\"]"), JSON.readTree("\"total\""));

            assertThat(result.columns()).containsExactly("id", "customer");
        }

        @Test
        void absentKeysLeaveDatasetUnchanged() {
            assertThat(DatasetOps.project(orders(), null, null)).isEqualTo(orders());
        }
    }

    @Test
    void whereKeepsMatchingRows() {
        var predicate = new JsltExpressionEngine().compile(".customer == \"c1\"");

        Dataset result = DatasetOps.where(orders(), predicate);

        assertThat(texts(result, "id")).containsExactly("1", "3");
    }

    @Nested
    class OrderBy {

        @Test
        void numericDescendingWithNullsLast() {
            Dataset result = DatasetOps.orderBy(orders(), "total desc");

            assertThat(texts(result, "id")).containsExactly("1", "4", "2", "3");
        }

        @Test
        void multipleKeysAreStable() {
            Dataset result = DatasetOps.orderBy(orders(), "customer, id desc");

            assertThat(texts(result, "id")).containsExactly("3", "1", "2", "4");
        }

        @Test
        @DisplayName("Mixed types → grouped by type, ordered by value within each")
        void mixedTypesAreRankedByType() {
            Dataset mixed = Dataset.builder(List.of("v"))
                    .addValues("10")
                    .addValues(9)
                    .addValues(true)
                    .addValues("9")
                    .addValues(10)
                    .addValues(false)
                    .build();

            assertThat(texts(DatasetOps.orderBy(mixed, "v"), "v"))
                    .containsExactly("false", "true", "9", "10", "10", "9");
        }

        @Test
        @DisplayName("Number, text and boolean compare consistently whichever side they are on")
        void comparisonIsTransitive() throws Exception {
            List<JsonNode> values = List.of(
                    JSON.readTree("10"), JSON.readTree("\"9\""), JSON.readTree("9"),
                    JSON.readTree("\"abc\""), JSON.readTree("true"), JSON.readTree("[1]"), JSON.readTree("{\"a\":1}"));

            for (JsonNode a : values) {
                for (JsonNode b : values) {
                    assertThat(Integer.signum(DatasetOps.compareValues(a, b)))
                            .as("%s vs %s", a, b)
                            .isEqualTo(-Integer.signum(DatasetOps.compareValues(b, a)));
                    for (JsonNode c : values) {
                        if (DatasetOps.compareValues(a, b) < 0 && DatasetOps.compareValues(b, c) < 0) {
                            assertThat(DatasetOps.compareValues(a, c)).as("%s < %s < %s", a, b, c).isNegative();
                        }
                    }
                }
            }
        }

        @Test
        void invalidDirectionIsRejected() {
            assertThatThrownBy(() -> DatasetOps.orderBy(orders(), "total sideways"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("sideways");
        }
    }

    @Nested
    class Merge {

        @Test
        void appendNeedsSameColumns() {
            assertThatThrownBy(() -> DatasetOps.merge(orders(), customers(), null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("'merge'");
        }

        @Test
        void appendKeepsOrder() {
            Dataset result = DatasetOps.merge(orders(), orders(), null);

            assertThat(result.rowCount()).isEqualTo(8);
            assertThat(texts(result, "id").subList(3, 5)).containsExactly("4", "1");
        }

        @Test
        void unionFillsMissingColumnsWithNull() throws Exception {
            Dataset result = DatasetOps.merge(customers(), orders(), JSON.readTree("\"union\""));

            assertThat(result.columns()).containsExactly("customer", "name", "id", "total");
            assertThat(result.rowCount()).isEqualTo(7);
            assertThat(result.value(0, "id").isNull()).isTrue();
            assertThat(result.value(3, "name").isNull()).isTrue();
        }

        @Test
        void joinObjectSelectsJoin() throws Exception {
            Dataset result =
                    DatasetOps.merge(orders(), customers(), JSON.readTree("{\"how\": \"inner\", \"on\": \"customer\"}"));

            assertThat(result.columns()).containsExactly("id", "customer", "total", "name");
            assertThat(texts(result, "name")).containsExactly("Ada", "Grace", "Ada");
        }
    }

    @Nested
    class Join {

        @Test
        void leftJoinKeepsUnmatchedLeftRows() {
            Dataset result = DatasetOps.join(orders(), customers(), "left", List.of("customer"), List.of("customer"));

            assertThat(result.rowCount()).isEqualTo(4);
            assertThat(result.value(3, "name").isNull()).isTrue();
        }

        @Test
        void outerJoinAppendsUnmatchedRightRowsWithTheirKey() {
            Dataset result = DatasetOps.join(orders(), customers(), "outer", List.of("customer"), List.of("customer"));

            assertThat(result.rowCount()).isEqualTo(5);
            assertThat(result.value(4, "customer").asText()).isEqualTo("c9");
            assertThat(result.value(4, "id").isNull()).isTrue();
        }

        @Test
        void clashingColumnsGetSuffix() {
            Dataset left = Dataset.builder(List.of("k", "v")).addValues(1, "l").build();
            Dataset right = Dataset.builder(List.of("key", "v")).addValues(1, "r").build();

            Dataset result = DatasetOps.join(left, right, "inner", List.of("k"), List.of("key"));

            assertThat(result.columns()).containsExactly("k", "v", "key", "v_right");
        }

        @Test
        @DisplayName("Suffixed name already taken → numbered suffix")
        void suffixedNameAlreadyTaken() {
            Dataset left = Dataset.builder(List.of("k", "v", "v_right")).addValues(1, "l", "l2").build();
            Dataset right = Dataset.builder(List.of("k", "v", "v_right")).addValues(1, "r", "r2").build();

            Dataset result = DatasetOps.join(left, right, "inner", List.of("k"), List.of("k"));

            assertThat(result.columns()).containsExactly("k", "v", "v_right", "v_right2", "v_right_right");
            assertThat(result.value(0, "v_right2").asText()).isEqualTo("r");
            assertThat(result.value(0, "v_right_right").asText()).isEqualTo("r2");
        }

        @Test
        void numericKeysMatchAcrossRepresentations() {
            Dataset left = Dataset.builder(List.of("k")).addValues(1).build();
            Dataset right = Dataset.builder(List.of("k", "x")).addValues(1.0, "hit").build();

            Dataset result = DatasetOps.join(left, right, "inner", List.of("k"), List.of("k"));

            assertThat(texts(result, "x")).containsExactly("hit");
        }

        @Test
        void nullKeysNeverMatch() {
            Dataset left = Dataset.builder(List.of("k")).addValues((Object) null).build();
            Dataset right = Dataset.builder(List.of("k", "x")).addValues(null, "miss").build();

            assertThat(DatasetOps.join(left, right, "inner", List.of("k"), List.of("k")).rowCount())
                    .isZero();
        }
    }

    @Test
    void concatenateNeedsEqualRowCounts() {
        assertThatThrownBy(() -> DatasetOps.concatenate(List.of(orders(), customers())))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("4 and 3 rows");
    }
}
