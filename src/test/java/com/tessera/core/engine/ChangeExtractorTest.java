package com.tessera.core.engine;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ChangeExtractorTest {

    private static final String RESPONSE = """
            Here is the fix:
            ```java src/A.java
            class A {}
            ```
            done
            """;

    private static List<ChangeExtractor.Block> blocks(List<ChangeExtractor.Extracted> items) {
        return items.stream()
                .filter(ChangeExtractor.Block.class::isInstance)
                .map(ChangeExtractor.Block.class::cast)
                .toList();
    }

    private static String prose(List<ChangeExtractor.Extracted> items) {
        var sb = new StringBuilder();
        for (ChangeExtractor.Extracted item : items) {
            if (item instanceof ChangeExtractor.Prose p) {
                sb.append(p.text());
            }
        }
        return sb.toString();
    }

    private static List<ChangeExtractor.Extracted> feed(ChangeExtractor extractor, String... chunks) {
        var items = new ArrayList<ChangeExtractor.Extracted>();
        for (String chunk : chunks) {
            items.addAll(extractor.accept(chunk));
        }
        return items;
    }

    @Nested
    @DisplayName("complete blocks")
    class CompleteBlockTests {

        @Test
        @DisplayName("splits prose, block and trailing prose in order")
        void wholeResponse() {
            var extractor = new ChangeExtractor();
            List<ChangeExtractor.Extracted> items = extractor.accept(RESPONSE);

            assertEquals(3, items.size());
            assertEquals(new ChangeExtractor.Prose("Here is the fix:\n"), items.get(0));
            assertEquals(new ChangeExtractor.Block("src/A.java", "class A {}\n", false, "Here is the fix:", true),
                    items.get(1));
            assertEquals(new ChangeExtractor.Prose("done\n"), items.get(2));
            assertFalse(extractor.finish().truncated());
        }

        @Test
        @DisplayName("character-by-character streaming yields the same block")
        void fragmented() {
            var extractor = new ChangeExtractor();
            var items = new ArrayList<ChangeExtractor.Extracted>();
            for (char c : RESPONSE.toCharArray()) {
                items.addAll(extractor.accept(String.valueOf(c)));
            }
            items.addAll(extractor.finish().items());

            assertEquals(List.of(new ChangeExtractor.Block("src/A.java", "class A {}\n", false, "Here is the fix:", true)),
                    blocks(items));
            assertEquals("Here is the fix:\ndone\n", prose(items));
        }

        @Test
        @DisplayName("recognizes diff blocks")
        void diffBlock() {
            var items = feed(new ChangeExtractor(), "```diff src/A.java\n@@ -1 +1 @@\n-a\n+b\n```\n");

            ChangeExtractor.Block block = blocks(items).get(0);
            assertTrue(block.diff());
            assertEquals("@@ -1 +1 @@\n-a\n+b\n", block.body());
        }

        @Test
        @DisplayName("accepts path=, colon and bare-path info strings")
        void infoStringForms() {
            var items = feed(new ChangeExtractor(),
                    "```java path=src/B.java\nb\n```\n",
                    "```ts:src/c.ts\nc\n```\n",
                    "```src/d.py\nd\n```\n");

            assertEquals(List.of("src/B.java", "src/c.ts", "src/d.py"),
                    blocks(items).stream().map(ChangeExtractor.Block::path).toList());
        }

        @Test
        @DisplayName("blocks without a path pass through as prose")
        void codeSample() {
            var items = feed(new ChangeExtractor(), "Run:\n```bash\nls -la\n```\n");

            assertTrue(blocks(items).isEmpty());
            assertEquals("Run:\n```bash\nls -la\n```\n", prose(items));
        }

        @Test
        @DisplayName("a longer fence may contain shorter ones")
        void nestedFence() {
            var items = feed(new ChangeExtractor(), "````md docs/x.md\n```\ninner\n```\n````\n");

            assertEquals("```\ninner\n```\n", blocks(items).get(0).body());
        }
    }

    @Nested
    @DisplayName("finish")
    class FinishTests {

        @Test
        @DisplayName("an unclosed block is reported incomplete and truncated")
        void unclosed() {
            var extractor = new ChangeExtractor();
            feed(extractor, "```java src/A.java\nclass A");

            ChangeExtractor.Result result = extractor.finish();

            assertTrue(result.truncated());
            var block = blocks(result.items()).get(0);
            assertFalse(block.complete());
            assertEquals("class A", block.body());
        }

        @Test
        @DisplayName("a closing fence without newline still closes the block")
        void closingWithoutNewline() {
            var extractor = new ChangeExtractor();
            var items = feed(extractor, "```java a/B.java\nx\n```");

            assertTrue(blocks(items).isEmpty());
            ChangeExtractor.Result result = extractor.finish();
            assertFalse(result.truncated());
            assertTrue(blocks(result.items()).get(0).complete());
        }

        @Test
        @DisplayName("buffered prose without newline is flushed")
        void trailingProse() {
            var extractor = new ChangeExtractor();
            var items = feed(extractor, "``not a fence");
            items.addAll(extractor.finish().items());

            assertEquals("``not a fence", prose(items));
        }
    }
}
