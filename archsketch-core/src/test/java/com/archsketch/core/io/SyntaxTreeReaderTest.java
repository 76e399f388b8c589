package com.archsketch.core.io;

import com.archsketch.core.model.Position;
import com.archsketch.core.model.Span;
import com.archsketch.core.model.SyntaxNode;
import com.archsketch.core.walker.TreeWalker;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link SyntaxTreeReader}.
 */
class SyntaxTreeReaderTest {

    private final SyntaxTreeReader reader = new SyntaxTreeReader();

    @Test
    void read_kindTextShape_withSpanObject() throws IOException {
        String json = """
            {
              "kind": "struct_type",
              "text": "ClusterModule",
              "span": {"start": {"row": 3, "column": 1}, "end": {"row": 9, "column": 2}},
              "children": [
                {"kind": "field_identifier", "text": "In"}
              ]
            }
            """;

        SyntaxNode node = reader.read(json);

        assertThat(node.kind()).isEqualTo("struct_type");
        assertThat(node.text()).isEqualTo("ClusterModule");
        assertThat(node.span()).isEqualTo(new Span(new Position(3, 1), new Position(9, 2)));
        assertThat(node.children()).singleElement().extracting(SyntaxNode::text).isEqualTo("In");
    }

    @Test
    void read_treeSitterShape_withTypeAndPointArrays() throws IOException {
        String json = """
            {
              "type": "send_statement",
              "start_point": [12, 4],
              "end_point": [12, 15],
              "children": []
            }
            """;

        SyntaxNode node = reader.read(json);

        assertThat(node.kind()).isEqualTo("send_statement");
        assertThat(node.text()).isNull();
        assertThat(node.span().start()).isEqualTo(new Position(12, 4));
        assertThat(node.span().end()).isEqualTo(new Position(12, 15));
    }

    @Test
    void read_startEndWithLineKeys() throws IOException {
        SyntaxNode node = reader.read("{\"kind\":\"x\",\"start\":{\"line\":5,\"column\":0},\"end\":{\"line\":6}}");

        assertThat(node.span()).isEqualTo(new Span(new Position(5, 0), new Position(6, 0)));
    }

    @Test
    void read_missingFields_useDefaults() throws IOException {
        SyntaxNode node = reader.read("{\"children\": [42, {\"text\": null}]}");

        assertThat(node.kind()).isEmpty();
        assertThat(node.span()).isEqualTo(Span.EMPTY);
        assertThat(node.children()).hasSize(2);
        assertThat(node.children().get(0).kind()).isEmpty();
        assertThat(node.children().get(1).hasText()).isFalse();
    }

    @Test
    void read_deeplyNestedTree_doesNotOverflow() throws IOException {
        // Given: 20,000 nested nodes
        int depth = 20_000;
        StringBuilder json = new StringBuilder();
        for (int i = 0; i < depth; i++) {
            json.append("{\"kind\":\"block\",\"children\":[");
        }
        json.append("{\"kind\":\"identifier\",\"text\":\"leaf\"}");
        for (int i = 0; i < depth; i++) {
            json.append("]}");
        }

        // When
        SyntaxNode root = reader.read(json.toString());

        // Then
        AtomicInteger count = new AtomicInteger();
        TreeWalker.walk(root, node -> count.incrementAndGet());
        assertThat(count.get()).isEqualTo(depth + 1);
    }

    @Test
    void read_malformedJson_throws() {
        assertThatThrownBy(() -> reader.read("{\"kind\": "))
            .isInstanceOf(IOException.class);
    }
}
