package com.example.acl.request.parser;

import com.example.acl.request.model.NQuad;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("NQuadParser")
class NQuadParserTest {

    @Nested
    @DisplayName("valid input")
    class ValidInput {

        @Test
        @DisplayName("should parse literals, node references and blank nodes")
        void shouldParseTriples() {
            List<NQuad> quads = NQuadParser.parse("""
                    _:alice <name> "Alice" .
                    _:alice <friend> _:bob .
                    <0x1> <friend> <0x2> .
                    """);

            assertThat(quads).containsExactly(
                    NQuad.literal("_:alice", "name", "Alice"),
                    NQuad.node("_:alice", "friend", "_:bob"),
                    NQuad.node("0x1", "friend", "0x2"));
        }

        @Test
        @DisplayName("should parse wildcard deletes")
        void shouldParseWildcards() {
            List<NQuad> quads = NQuadParser.parse("<0x1> <age> * .\n<0x2> * * .");

            assertThat(quads.get(0)).isEqualTo(NQuad.wildcard("0x1", "age"));
            assertThat(quads.get(1).isWildcardPredicate()).isTrue();
            assertThat(quads.get(1).kind()).isEqualTo(NQuad.ObjectKind.WILDCARD);
        }

        @Test
        @DisplayName("should drop type and language annotations")
        void shouldDropAnnotations() {
            List<NQuad> quads = NQuadParser.parse("_:a <age> \"30\"^^<xs:int> .\n_:a <greeting> \"bonjour\"@fr .");

            assertThat(quads).extracting(NQuad::object).containsExactly("30", "bonjour");
        }

        @Test
        @DisplayName("should unescape quotes and newlines in literals")
        void shouldUnescapeLiterals() {
            List<NQuad> quads = NQuadParser.parse("_:a <bio> \"says \\\"hi\\\"\\nthen leaves\" .");

            assertThat(quads.get(0).object()).isEqualTo("says \"hi\"\nthen leaves");
        }

        @Test
        @DisplayName("should skip comments and blank input")
        void shouldSkipComments() {
            assertThat(NQuadParser.parse("# nothing here\n\n")).isEmpty();
            assertThat(NQuadParser.parse(null)).isEmpty();
            assertThat(NQuadParser.parse("# first\n_:a <name> \"x\" .")).hasSize(1);
        }
    }

    @Nested
    @DisplayName("malformed input")
    class MalformedInput {

        @Test
        @DisplayName("should name the line of the error")
        void shouldReportLine() {
            assertThatThrownBy(() -> NQuadParser.parse("_:a <name> \"x\" .\n_:a <name> \"y\""))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("malformed mutation at line 2: expected '.'");
        }

        @Test
        @DisplayName("should reject a wildcard predicate with a concrete object")
        void shouldRejectHalfWildcard() {
            assertThatThrownBy(() -> NQuadParser.parse("<0x1> * \"x\" ."))
                    .hasMessageContaining("a wildcard predicate requires a wildcard object");
        }

        @Test
        @DisplayName("should reject an unterminated literal")
        void shouldRejectUnterminatedLiteral() {
            assertThatThrownBy(() -> NQuadParser.parse("_:a <name> \"Alice ."))
                    .hasMessageContaining("unterminated string literal");
        }

        @Test
        @DisplayName("should reject a missing subject")
        void shouldRejectMissingSubject() {
            assertThatThrownBy(() -> NQuadParser.parse("\"x\" <name> \"y\" ."))
                    .hasMessageContaining("expected subject");
        }
    }
}
