package org.pragmatica.prompt.parser;

import org.junit.jupiter.api.Test;
import org.pragmatica.prompt.error.ParseError;
import org.pragmatica.prompt.error.ParsingException;
import org.pragmatica.prompt.tree.PromptNode;
import org.pragmatica.prompt.tree.PromptNode.Attention;
import org.pragmatica.prompt.tree.PromptNode.Blend;
import org.pragmatica.prompt.tree.PromptNode.Conjunction;
import org.pragmatica.prompt.tree.PromptNode.CrossAttentionControlSubstitute;
import org.pragmatica.prompt.tree.PromptNode.Fragment;
import org.pragmatica.prompt.tree.PromptNode.Prompt;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PromptEngineTest {

    private final PromptEngine engine = PromptEngine.create(ParserConfig.DEFAULT);

    // === Raw Trees ===

    @Test
    void parseRaw_blankInput_yieldsPromptWithEmptyFragment() {
        assertThat(engine.parseRaw("  "))
            .isEqualTo(Conjunction.of(new Prompt(List.of(new Fragment("")))));
    }

    @Test
    void parseRaw_keepsAttentionScopes() {
        var expected = Conjunction.of(new Prompt(List.of(
            new Fragment("fire"),
            new Attention(2.0, List.of(new Fragment("flames"),
                                       new Attention(1.5, List.of(new Fragment("trees"))))))));

        assertThat(engine.parseRaw("fire 2.0(flames 1.5(trees))")).isEqualTo(expected);
    }

    @Test
    void parseRaw_keepsWordsSeparate() {
        var raw = engine.parseRaw("a forest landscape");

        assertThat(raw.prompts()).hasSize(1);
        assertThat(((Prompt) raw.prompts().get(0)).children())
            .containsExactly(new Fragment("a"), new Fragment("forest"), new Fragment("landscape"));
    }

    @Test
    void parseRaw_plainGroupInsideAttention_isSpliced() {
        var expected = Conjunction.of(new Prompt(List.of(
            new Attention(1.1, List.of(new Fragment("a"), new Fragment("b"), new Fragment("c"))))));

        assertThat(engine.parseRaw("+(a (b) c)")).isEqualTo(expected);
    }

    @Test
    void parseRaw_quotedStringInsideAttention_isReparsed() {
        var expected = Conjunction.of(new Prompt(List.of(
            new Attention(1.1, List.of(new Fragment("x"), new Attention(2.0, List.of(new Fragment("y"))))))));

        assertThat(engine.parseRaw("+(x \"2(y)\")")).isEqualTo(expected);
    }

    @Test
    void parseRaw_substituteSidesHoldAttention() {
        var raw = engine.parseRaw("\"0.5(flames)\".swap(trees)");
        var prompt = (Prompt) raw.prompts().get(0);

        assertThat(prompt.children()).containsExactly(
            new CrossAttentionControlSubstitute(List.of(new Attention(0.5, List.of(new Fragment("flames")))),
                                                List.of(new Fragment("trees"))));
    }

    @Test
    void parseRaw_blend_holdsRawPrompts() {
        var raw = engine.parseRaw("(\"a b\", \"+c\").blend(0.25, 0.75)");

        assertThat(raw.prompts()).hasSize(1);
        assertThat(raw.prompts().get(0)).isInstanceOf(Blend.class);

        var blend = (Blend) raw.prompts().get(0);
        assertThat(blend.weights()).containsExactly(0.25, 0.75);
        assertThat(blend.normalizeWeights()).isTrue();
        assertThat(blend.prompts()).containsExactly(
            new Prompt(List.of(new Fragment("a"), new Fragment("b"))),
            new Prompt(List.of(new Attention(1.1, List.of(new Fragment("c"))))));
    }

    @Test
    void parseRaw_twoBlends_yieldTwoBranches() {
        var raw = engine.parseRaw("(\"a\").blend(1) (\"b\").blend(2)");

        assertThat(raw.prompts()).hasSize(2);
        assertThat(raw.prompts()).allMatch(Blend.class::isInstance);
        assertThat(raw.weights()).containsExactly(1.0, 1.0);
    }

    @Test
    void parseRaw_explicitConjunction_carriesWeights() {
        var raw = engine.parseRaw(" (\"a\", \"b\") .and( 0.5 , -1.0 ) ");

        assertThat(raw.type()).isEqualTo("AND");
        assertThat(raw.weights()).containsExactly(0.5, -1.0);
        assertThat(raw.prompts()).containsExactly(new Prompt(List.of(new Fragment("a"))),
                                                  new Prompt(List.of(new Fragment("b"))));
    }

    // === Configuration ===

    @Test
    void parse_customBases_areUsedForSignRuns() {
        var custom = PromptEngine.create(new ParserConfig(2.0, 0.5, 100));

        assertThat(custom.parseRaw("++(x) -y"))
            .isEqualTo(Conjunction.of(new Prompt(List.<PromptNode>of(
                new Attention(4.0, List.of(new Fragment("x"))),
                new Attention(0.5, List.of(new Fragment("y")))))));
    }

    @Test
    void parse_nestingWithinLimit_succeeds() {
        var shallow = PromptEngine.create(new ParserConfig(1.1, 0.9, 2));

        assertThat(shallow.parse("+(+(x))").prompts()).hasSize(1);
    }

    @Test
    void parse_nestingBeyondLimit_throwsNestingTooDeep() {
        var shallow = PromptEngine.create(new ParserConfig(1.1, 0.9, 2));

        assertThatThrownBy(() -> shallow.parse("+(+(+(x)))"))
            .isInstanceOf(ParsingException.class)
            .satisfies(e -> assertThat(((ParsingException) e).error()).isInstanceOf(ParseError.NestingTooDeep.class))
            .hasMessageContaining("nesting deeper than 2");
    }

    @Test
    void parse_unclosedBodyBeyondLimit_degradesToText() {
        var shallow = PromptEngine.create(new ParserConfig(1.1, 0.9, 2));

        assertThat(shallow.parse("+(+(+(x"))
            .isEqualTo(Conjunction.of(PromptNode.FlattenedPrompt.of(new Fragment("+(+(+(x"))));
    }

    @Test
    void parseRaw_closedAttentionAfterUnclosedOne_isParsedOnce() {
        var expected = Conjunction.of(new Prompt(List.of(
            new Fragment("+(a"),
            new Attention(1.1, List.of(new Fragment("b"))))));

        assertThat(engine.parseRaw("+(a +(b)")).isEqualTo(expected);
    }

    @Test
    void parse_deepQuotedNesting_countsAcrossQuotes() {
        var shallow = PromptEngine.create(new ParserConfig(1.1, 0.9, 1));

        assertThatThrownBy(() -> shallow.parse("+(\"+(x)\")"))
            .isInstanceOf(ParsingException.class);
    }

    @Test
    void parse_mismatchedBlend_reportsCounts() {
        assertThatThrownBy(() -> engine.parse("(\"a\", \"b\", \"c\").blend(1, 2)"))
            .isInstanceOf(ParsingException.class)
            .hasMessage("while parsing Blend: mismatched prompts/weights counts 3 and 2");
    }

    @Test
    void config_isExposed() {
        assertThat(engine.config()).isEqualTo(ParserConfig.DEFAULT);
        assertThat(ParserConfig.DEFAULT.attentionPlusBase()).isEqualTo(1.1);
        assertThat(ParserConfig.DEFAULT.attentionMinusBase()).isEqualTo(0.9);
    }
}
