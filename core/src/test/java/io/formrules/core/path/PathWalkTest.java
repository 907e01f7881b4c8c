package io.formrules.core.path;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for {@link Path#walk(Object, java.util.function.Consumer)}. */
@DisplayName("Path walking")
class PathWalkTest {

    private static List<WalkContext> walk(String path, Object data) {
        List<WalkContext> contexts = new ArrayList<>();
        Path.parse(path).walk(data, contexts::add);
        return contexts;
    }

    private static Map<String, Object> map(Object... keysAndValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            map.put((String) keysAndValues[i], keysAndValues[i + 1]);
        }
        return map;
    }

    private static List<Object> list(Object... elements) {
        return new ArrayList<>(List.of(elements));
    }

    @Nested
    @DisplayName("Maps")
    class Maps {

        @Test
        @DisplayName("top-level field → found with the form as parent")
        void topLevel() {
            Map<String, Object> form = map("name", "Ada");

            List<WalkContext> contexts = walk("name", form);

            assertThat(contexts).singleElement().satisfies(context -> {
                assertThat(context.notFound()).isFalse();
                assertThat(context.value()).isEqualTo("Ada");
                assertThat(context.parent()).isSameAs(form);
                assertThat(context.name()).isEqualTo("name");
                assertThat(context.index()).isEqualTo(-1);
                assertThat(context.path()).hasToString("name");
            });
        }

        @Test
        @DisplayName("missing key → one not-found context")
        void missingKey() {
            Map<String, Object> inner = map();

            List<WalkContext> contexts = walk("a.b", map("a", inner));

            assertThat(contexts).singleElement().satisfies(context -> {
                assertThat(context.notFound()).isTrue();
                assertThat(context.value()).isNull();
                assertThat(context.parent()).isSameAs(inner);
                assertThat(context.name()).isEqualTo("b");
                assertThat(context.path()).hasToString("a.b");
            });
        }

        @Test
        @DisplayName("present null → found with null value")
        void presentNull() {
            List<WalkContext> contexts = walk("a.b", map("a", map("b", null)));

            assertThat(contexts).singleElement().satisfies(context -> {
                assertThat(context.notFound()).isFalse();
                assertThat(context.value()).isNull();
            });
        }

        @Test
        @DisplayName("intermediate value not a map → not found")
        void intermediateScalar() {
            List<WalkContext> contexts = walk("a.b", map("a", "text"));

            assertThat(contexts).singleElement().satisfies(context -> {
                assertThat(context.notFound()).isTrue();
                assertThat(context.parent()).isEqualTo("text");
            });
        }

        @Test
        @DisplayName("root that is not a map → not found")
        void rootNotMap() {
            assertThat(walk("a", list("x"))).singleElement().satisfies(context -> assertThat(context.notFound())
                    .isTrue());
        }
    }

    @Nested
    @DisplayName("Arrays")
    class Arrays {

        @Test
        @DisplayName("list[].x over three objects → three contexts with exact paths")
        void fanOut() {
            Map<String, Object> form = map("list", list(map("x", 1), map("x", 2), map("x", 3)));

            List<WalkContext> contexts = walk("list[].x", form);

            assertThat(contexts).extracting(WalkContext::value).containsExactly(1, 2, 3);
            assertThat(contexts)
                    .extracting(context -> context.path().toString())
                    .containsExactly("list[0].x", "list[1].x", "list[2].x");
            assertThat(contexts).allSatisfy(context -> {
                assertThat(context.notFound()).isFalse();
                assertThat(context.parent()).isInstanceOf(Map.class);
                assertThat(context.index()).isEqualTo(-1);
            });
        }

        @Test
        @DisplayName("tags[] → one context per element, parent is the list")
        void leafArray() {
            List<Object> tags = list("a", "b");

            List<WalkContext> contexts = walk("tags[]", map("tags", tags));

            assertThat(contexts).hasSize(2);
            assertThat(contexts.get(1).value()).isEqualTo("b");
            assertThat(contexts.get(1).parent()).isSameAs(tags);
            assertThat(contexts.get(1).index()).isEqualTo(1);
            assertThat(contexts.get(1).name()).isEmpty();
            assertThat(contexts.get(1).path()).hasToString("tags[1]");
        }

        @Test
        @DisplayName("empty list under a leaf → no context")
        void emptyLeafArray() {
            assertThat(walk("tags[]", map("tags", list()))).isEmpty();
        }

        @Test
        @DisplayName("empty list followed by a field → one not-found context")
        void emptyArrayOfObjects() {
            assertThat(walk("list[].x", map("list", list())))
                    .singleElement()
                    .satisfies(context -> assertThat(context.notFound()).isTrue());
        }

        @Test
        @DisplayName("value not a list → not found")
        void notAList() {
            assertThat(walk("list[].x", map("list", map("x", 1))))
                    .singleElement()
                    .satisfies(context -> assertThat(context.notFound()).isTrue());
        }

        @Test
        @DisplayName("element missing the field → not found for that element only")
        void partialElements() {
            Map<String, Object> form = map("list", list(map("x", 1), map("y", 2)));

            List<WalkContext> contexts = walk("list[].x", form);

            assertThat(contexts).hasSize(2);
            assertThat(contexts.get(0).notFound()).isFalse();
            assertThat(contexts.get(1).notFound()).isTrue();
            assertThat(contexts.get(1).path()).hasToString("list[1].x");
        }

        @Test
        @DisplayName("matrix[][] → exact paths carry both indices")
        void nestedArrays() {
            Map<String, Object> form = map("matrix", list(list(1, 2), list(3)));

            List<WalkContext> contexts = walk("matrix[][]", form);

            assertThat(contexts).extracting(WalkContext::value).containsExactly(1, 2, 3);
            assertThat(contexts)
                    .extracting(context -> context.path().toString())
                    .containsExactly("matrix[0][0]", "matrix[0][1]", "matrix[1][0]");
        }

        @Test
        @DisplayName("nested fan-out keeps independent exact paths")
        void nestedFanOut() {
            Map<String, Object> form = map(
                    "groups",
                    list(map("members", list(map("name", "a"), map("name", "b"))), map("members", list(map(
                            "name", "c")))));

            List<WalkContext> contexts = walk("groups[].members[].name", form);

            assertThat(contexts)
                    .extracting(context -> context.path().toString())
                    .containsExactly("groups[0].members[0].name", "groups[0].members[1].name",
                            "groups[1].members[0].name");
        }

        @Test
        @DisplayName("fixed index explores one element only")
        void fixedIndex() {
            Map<String, Object> form = map("list", list(map("x", 1), map("x", 2)));
            Path path = Path.array("list", 1, Path.object("", Path.element("x")));
            List<WalkContext> contexts = new ArrayList<>();

            path.walk(form, contexts::add);

            assertThat(contexts).singleElement().satisfies(context -> {
                assertThat(context.value()).isEqualTo(2);
                assertThat(context.path()).hasToString("list[1].x");
            });
        }

        @Test
        @DisplayName("fixed index out of bounds → not found")
        void fixedIndexOutOfBounds() {
            Path path = Path.array("list", 5, Path.element(""));
            List<WalkContext> contexts = new ArrayList<>();

            path.walk(map("list", list("a")), contexts::add);

            assertThat(contexts).singleElement().satisfies(context -> assertThat(context.notFound())
                    .isTrue());
        }
    }

    @Test
    @DisplayName("walking never modifies the parsed path")
    void parsedPathUnchanged() {
        Path path = Path.parse("list[].x");
        path.walk(map("list", list(map("x", 1), map("x", 2))), context -> {});

        assertThat(path).hasToString("list[].x");
        assertThat(path.index()).isNull();
    }
}
