package io.datawrangle.core.engine.builtin;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import io.datawrangle.core.RecipeEngine;
import io.datawrangle.core.connector.MemoryStore;
import io.datawrangle.core.engine.RunOptions;
import io.datawrangle.core.function.CustomFunctionReference;
import io.datawrangle.core.function.FunctionType;
import io.datawrangle.core.function.SlugifyFunction;
import io.datawrangle.core.function.TextFunctions;
import io.datawrangle.core.model.Dataset;
import io.datawrangle.core.model.ExecutionRecord;
import io.datawrangle.core.model.RunState;
import io.datawrangle.core.model.RunSummary;
import io.datawrangle.core.model.Section;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Behaviour of the built-in wrangle and aggregate read kinds, run through a {@link RecipeEngine}. */
class BuiltinStepsTest {

    private static final String FIXTURES = TextFunctions.class.getName();

    private final MemoryStore store = new MemoryStore();
    private final RecipeEngine engine = RecipeEngine.builder().memoryStore(store).build();

    @BeforeEach
    void people() {
        store.put("people", Dataset.builder(List.of("name", "city", "tags"))
                .addValues("Ada Lovelace", "London", "math,poetry")
                .addValues("Grace Hopper", "New York", "navy")
                .addValues("Alan Turing", null, "")
                .build());
    }

    private Dataset wrangle(String wrangles) {
        return wrangle(wrangles, RunOptions.defaults());
    }

    private Dataset wrangle(String wrangles, RunOptions options) {
        RunSummary summary = engine.run("read:\n  - memory: people\nwrangles:\n" + wrangles, options);
        assertThat(summary.failure()).isNull();
        return summary.dataset();
    }

    private static List<String> texts(Dataset dataset, String column) {
        return dataset.column(column).stream().map(JsonNode::asText).toList();
    }

    @Nested
    class Text {

        @Test
        @DisplayName("Several columns into several outputs, nulls kept")
        void lowercaseIntoOutputs() {
            Dataset result = wrangle("""
                      - lowercase:
                          column: [name, city]
                          output: [name_lc, city_lc]
                    """);

            assertThat(result.columns()).containsExactly("name", "city", "tags", "name_lc", "city_lc");
            assertThat(texts(result, "name_lc")).containsExactly("ada lovelace", "grace hopper", "alan turing");
            assertThat(result.value(2, "city_lc").isNull()).isTrue();
        }

        @Test
        void trimPrefixSuffix() {
            store.put("people", Dataset.builder(List.of("name")).addValues("  Ada ").build());

            Dataset result = wrangle("""
                      - trim:
                          column: name
                      - prefix:
                          column: name
                          value: "<"
                      - suffix:
                          column: name
                          value: ">"
                    """);

            assertThat(texts(result, "name")).containsExactly("<Ada>");
        }

        @Test
        @DisplayName("Numbers are treated as their text")
        void numbersBecomeText() {
            store.put("people", Dataset.builder(List.of("id")).addValues(7).build());

            Dataset result = wrangle("""
                      - suffix:
                          column: id
                          value: "-a"
                    """);

            assertThat(texts(result, "id")).containsExactly("7-a");
        }
    }

    @Nested
    class Columns {

        @Test
        void renameKeepsPosition() {
            Dataset result = wrangle("""
                      - rename:
                          input: [name, city]
                          output: [full_name, town]
                    """);

            assertThat(result.columns()).containsExactly("full_name", "town", "tags");
        }

        @Test
        void copyAppendsColumn() {
            Dataset result = wrangle("""
                      - copy:
                          input: name
                          output: original
                    """);

            assertThat(result.columns()).containsExactly("name", "city", "tags", "original");
            assertThat(texts(result, "original")).isEqualTo(texts(result, "name"));
        }

        @Test
        void selectReorders() {
            Dataset result = wrangle("""
                      - select:
                          columns: [tags, name]
                    """);

            assertThat(result.columns()).containsExactly("tags", "name");
        }

        @Test
        void filterKeepsMatchingRows() {
            Dataset result = wrangle("""
                      - filter:
                          where: .city != null
                    """);

            assertThat(texts(result, "name")).containsExactly("Ada Lovelace", "Grace Hopper");
        }

        @Test
        @DisplayName("split.text with one output → JSON array")
        void splitIntoList() {
            Dataset result = wrangle("""
                      - split.text:
                          input: tags
                          output: tag_list
                    """);

            assertThat(result.value(0, "tag_list").isArray()).isTrue();
            assertThat(result.value(0, "tag_list")).hasSize(2);
            assertThat(result.value(1, "tag_list").get(0).asText()).isEqualTo("navy");
        }

        @Test
        @DisplayName("split.text with several outputs → one column each, missing parts null")
        void splitIntoColumns() {
            Dataset result = wrangle("""
                      - split.text:
                          input: name
                          char: " "
                          output: [first, last, middle]
                    """);

            assertThat(texts(result, "first")).containsExactly("Ada", "Grace", "Alan");
            assertThat(texts(result, "last")).containsExactly("Lovelace", "Hopper", "Turing");
            assertThat(result.column("middle")).allMatch(JsonNode::isNull);
        }

        @Test
        @DisplayName("rename with unequal lists → step fails at resolution")
        void renameMismatchFails() {
            RunSummary summary = engine.run("""
                    wrangles:
                      - rename:
                          input: [a, b]
                          output: c
                    """, RunOptions.defaults());

            assertThat(summary.failedIn()).isEqualTo(RunState.VALIDATED);
            assertThat(summary.failure()).hasMessageContaining("same number of columns");
        }
    }

    @Nested
    @DisplayName("Column selectors: wildcards, regex: and optional names")
    class Selectors {

        @Test
        void wildcardInColumn() {
            store.put("contacts", Dataset.builder(List.of("id", "name_first", "name_last"))
                    .addValues(1, "ada", "lovelace")
                    .build());

            RunSummary summary = engine.run("""
                    read:
                      - memory: contacts
                    wrangles:
                      - uppercase:
                          column: name_*
                    """, RunOptions.defaults());

            assertThat(summary.failure()).isNull();
            assertThat(summary.dataset().row(0)).extracting(JsonNode::asText).containsExactly("1", "ADA", "LOVELACE");
        }

        @Test
        void regexInDrop() {
            Dataset result = wrangle("""
                      - drop:
                          columns: "regex:(city|tags)"
                    """);

            assertThat(result.columns()).containsExactly("name");
        }

        @Test
        void optionalColumnInSelect() {
            Dataset result = wrangle("""
                      - select:
                          columns: [name, zip?]
                    """);

            assertThat(result.columns()).containsExactly("name");
        }

        @Test
        @DisplayName("Read-level not_columns and columns accept selectors")
        void readProjection() {
            RunSummary summary = engine.run("""
                    read:
                      - memory:
                          name: people
                          not_columns: "t*"
                          columns: [city?, "n*"]
                    """, RunOptions.defaults());

            assertThat(summary.dataset().columns()).containsExactly("city", "name");
        }

        @Test
        @DisplayName("Wildcard matching a different count than 'output' → step fails")
        void wildcardOutputMismatch() {
            RunSummary summary = engine.run("""
                    read:
                      - memory: people
                    wrangles:
                      - lowercase:
                          column: "*"
                          output: [a, b]
                    """, RunOptions.defaults());

            assertThat(summary.failedIn()).isEqualTo(RunState.TRANSFORMING);
            assertThat(summary.failure()).hasMessageContaining("as many columns");
        }
    }

    @Nested
    class Expressions {

        @Test
        void jsltComputesColumn() {
            Dataset result = wrangle("""
                      - jslt:
                          expression: size(split(.tags, ",")) > 1
                          output: many_tags
                    """);

            assertThat(texts(result, "many_tags")).containsExactly("true", "false", "false");
        }

        @Test
        @DisplayName("input restricts the fields the expression sees")
        void inputRestrictsRow() {
            Dataset result = wrangle("""
                      - jslt:
                          expression: "[for (.) .key]"
                          input: city
                          output: visible
                    """);

            assertThat(result.value(0, "visible").toString()).isEqualTo("[\"city\"]");
        }

        @Test
        void groupRunsWhenConditionHolds() {
            Dataset result = wrangle("""
                      - group:
                          if: .rowCount == 3
                          steps:
                            - uppercase:
                                column: city
                            - drop:
                                columns: tags
                    """);

            assertThat(result.columns()).containsExactly("name", "city");
            assertThat(texts(result, "city")).first().isEqualTo("LONDON");
        }
    }

    @Nested
    class CustomFunctions {

        private final RunOptions enabled = RunOptions.builder().enableCustomFunctions().build();

        @Test
        @DisplayName("Row function gets parameters merged into its payload")
        void rowFunctionWithParameters() {
            store.put("people", Dataset.builder(List.of("title")).addValues("Hello Big World").build());

            Dataset result = wrangle("""
                      - custom:
                          function: %s
                          input: title
                          output: slug
                          parameters:
                            separator: _
                    """.formatted(SlugifyFunction.class.getName()), enabled);

            assertThat(texts(result, "slug")).containsExactly("hello_big_world");
        }

        @Test
        @DisplayName("Object result fans out to several outputs")
        void rowFunctionSeveralOutputs() {
            Dataset result = wrangle("""
                      - custom:
                          function: %s#names
                          output: [first, last]
                    """.formatted(FIXTURES), enabled);

            assertThat(texts(result, "first")).containsExactly("Ada", "Grace", "Alan");
            assertThat(texts(result, "last")).containsExactly("Lovelace", "Hopper", "Turing");
        }

        @Test
        void columnFunction() {
            Dataset result = wrangle("""
                      - custom:
                          function: %s#lengths
                          type: column
                          input: name
                          output: name_length
                    """.formatted(FIXTURES), enabled);

            assertThat(texts(result, "name_length")).containsExactly("12", "12", "11");
        }

        @Test
        void columnFunctionMustReturnOneValuePerRow() {
            RunSummary summary = engine.run("""
                    read:
                      - memory: people
                    wrangles:
                      - custom:
                          function: %s#tooFew
                          type: column
                          input: name
                    """.formatted(FIXTURES), enabled);

            assertThat(summary.failedIn()).isEqualTo(RunState.TRANSFORMING);
            assertThat(summary.failure()).hasMessageContaining("returned 0 values for 3 rows");
        }

        @Test
        void datasetFunction() {
            Dataset result = wrangle("""
                      - custom:
                          function: %s#firstTwo
                          type: dataset
                    """.formatted(FIXTURES), enabled);

            assertThat(result.rowCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("Functions declared in the run options → custom.<name> kinds")
        void declaredFunctionKind() {
            RunOptions options = RunOptions.builder()
                    .function("shout", new CustomFunctionReference(null, FIXTURES + "#shout", FunctionType.ROW))
                    .build();

            Dataset result = wrangle("""
                      - custom.shout:
                          output: loud
                    """, options);

            assertThat(texts(result, "loud")).first().isEqualTo("ADA LOVELACE!");
        }

        @Test
        @DisplayName("Row function failures honour skip_row")
        void rowFunctionSkipRow() {
            store.put("people", Dataset.builder(List.of("name")).addValues("a").addValues("").addValues("c").build());

            RunSummary summary = engine.run("""
                    read:
                      - memory: people
                    wrangles:
                      - custom:
                          function: %s#fails
                          input: name
                          on_error: skip_row
                    """.formatted(FIXTURES), enabled);

            assertThat(texts(summary.dataset(), "name")).containsExactly("a", "c");
            ExecutionRecord record = summary.records(Section.WRANGLE).get(0);
            assertThat(record.skippedRows()).isEqualTo(1);
            assertThat(record.error()).contains("name is empty");
        }
    }

    @Nested
    class AggregateReadKinds {

        @BeforeEach
        void more() {
            store.put("a", Dataset.builder(List.of("id", "x")).addValues(1, "a1").addValues(2, "a2").build());
            store.put("b", Dataset.builder(List.of("id", "y")).addValues(2, "b2").addValues(3, "b3").build());
        }

        private Dataset read(String read) {
            RunSummary summary = engine.run("read:\n" + read, RunOptions.defaults());
            assertThat(summary.failure()).isNull();
            return summary.dataset();
        }

        @Test
        void unionOfColumns() {
            Dataset result = read("""
                      - union:
                          sources:
                            - memory: a
                            - memory: b
                    """);

            assertThat(result.columns()).containsExactly("id", "x", "y");
            assertThat(result.rowCount()).isEqualTo(4);
        }

        @Test
        void concatenateSideBySide() {
            Dataset result = read("""
                      - concatenate:
                          sources:
                            - memory: a
                            - memory:
                                name: b
                                columns: y
                    """);

            assertThat(result.columns()).containsExactly("id", "x", "y");
            assertThat(texts(result, "y")).containsExactly("b2", "b3");
        }

        @Test
        void joinOnKey() {
            Dataset result = read("""
                      - join:
                          how: outer
                          on: id
                          sources:
                            - memory: a
                            - memory: b
                    """);

            assertThat(texts(result, "id")).containsExactly("1", "2", "3");
            assertThat(texts(result, "y")).containsExactly("null", "b2", "b3");
        }

        @Test
        @DisplayName("Nested sources get their own records")
        void nestedRecords() {
            RunSummary summary = engine.run("""
                    read:
                      - union:
                          sources:
                            - memory: a
                            - memory:
                                name: b
                                if: "false"
                    """, RunOptions.defaults());

            assertThat(summary.records())
                    .extracting(r -> r.position().toString() + " " + r.status())
                    .containsExactly("read[0].sources[0] SUCCEEDED", "read[0].sources[1] SKIPPED", "read[0] SUCCEEDED");
            assertThat(summary.dataset().rowCount()).isEqualTo(2);
        }

        @Test
        void testDataConnector() {
            Dataset result = read("""
                      - test:
                          rows: 4
                          values:
                            id: 1
                            label: sample
                    """);

            assertThat(result.rowCount()).isEqualTo(4);
            assertThat(texts(result, "label")).containsOnly("sample");
        }
    }
}
