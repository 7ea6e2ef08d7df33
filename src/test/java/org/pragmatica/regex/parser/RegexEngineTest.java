package org.pragmatica.regex.parser;

import org.junit.jupiter.api.Test;
import org.pragmatica.regex.error.ParseError;
import org.pragmatica.regex.tree.RegexNode;
import org.pragmatica.regex.tree.RegexNode.And;
import org.pragmatica.regex.tree.RegexNode.CharRange;
import org.pragmatica.regex.tree.RegexNode.OneOrMore;
import org.pragmatica.regex.tree.RegexNode.Or;
import org.pragmatica.regex.tree.RegexNode.ZeroOrMore;
import org.pragmatica.regex.tree.SourceLocation;

import java.util.List;
import java.util.function.BiFunction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class RegexEngineTest {

    private static final RegexEngine ENGINE = RegexEngine.create(ParserConfig.DEFAULT);

    private static final List<String> SAMPLES = List.of(
        "", "a", "ab", "a|b", "a|", "|a", "(", ")", "()", "(a", "(a|b)", "((a))", "a**", "+", "?a",
        "\\", "ab\\", "\\n", ".", ".*", "a(b|c)+d", "c|d(f?|g)", "(|)", "a|b|c", "x)y", "((("
    );

    // === Concrete scenarios ===

    @Test
    void parsePrefix_defaultPattern_buildsExpectedTree() {
        var result = ENGINE.parsePrefix("c|d(f?|g)");

        var expected = new Or(lit('c'),
                              new And(lit('d'),
                                      new Or(new RegexNode.Optional(lit('f')), lit('g'))));
        assertTrue(result.isSuccess());
        assertEquals(expected, result.tree().orElseThrow());
        assertEquals(9, ((ParseResult.Success) result).consumed());
    }

    @Test
    void parse_singleChar_buildsCharRange() {
        var result = ENGINE.parse("a");

        assertTrue(result.isSuccess());
        var node = result.tree().orElseThrow();
        assertEquals(new CharRange('a', 'b'), node);
        assertTrue(node.children().isEmpty());
    }

    @Test
    void parsePrefix_emptyInput_producesNoTree() {
        var result = ENGINE.parsePrefix("");

        assertTrue(result.isFailure());
        assertTrue(result.tree().isEmpty());
        assertInstanceOf(ParseError.UnexpectedEof.class, result.error().orElseThrow());
    }

    @Test
    void parsePrefix_doublePostfix_consumesOnlyFirstOperator() {
        var result = ENGINE.parsePrefix("a**");

        assertEquals(new ZeroOrMore(lit('a')), result.tree().orElseThrow());
        assertEquals(2, ((ParseResult.Success) result).consumed());
    }

    @Test
    void parse_doublePostfix_reportsTrailingInput() {
        var result = ENGINE.parse("a**");

        var error = result.error().orElseThrow();
        assertInstanceOf(ParseError.TrailingInput.class, error);
        assertEquals(2, error.location().offset());
        assertEquals("*", ((ParseError.TrailingInput) error).remaining());
    }

    @Test
    void parse_escapedNewline_buildsControlChar() {
        var result = ENGINE.parse("\\n");

        assertEquals(new CharRange('\n', '\n' + 1), result.tree().orElseThrow());
    }

    @Test
    void parsePrefix_unterminatedGroup_producesNoTree() {
        var rules = new RegexEngine.Rules("(", ParserConfig.DEFAULT);

        var result = rules.alternation(SourceLocation.START);

        assertTrue(result.isFailure());
        assertEquals(SourceLocation.START, rules.cursor().location());
        assertTrue(ENGINE.tree("(").isEmpty());
    }

    // === Atoms ===

    @Test
    void parse_everyPlainChar_buildsSingleCharRange() {
        for (char c = 0; c < 0x80; c++) {
            if ("|*+?()\\.".indexOf(c) >= 0) {
                continue;
            }
            var result = ENGINE.parse(String.valueOf(c));

            assertTrue(result.isSuccess(), "char " + (int) c);
            assertEquals(CharRange.literal(c), result.tree().orElseThrow());
        }
    }

    @Test
    void parse_nulChar_isOrdinaryLiteral() {
        assertEquals(CharRange.literal('\0'), ENGINE.parse("\0").tree().orElseThrow());
    }

    @Test
    void parse_wildcard_spansWholeCharacterDomain() {
        var node = (CharRange) ENGINE.parse(".").tree().orElseThrow();

        assertEquals(0, node.begin());
        assertEquals(Character.MAX_VALUE + 1, node.end());
        assertTrue(node.contains(Character.MAX_VALUE));
    }

    @Test
    void parse_escapeTable_mapsControlCharacters() {
        assertEquals(CharRange.literal('\b'), ENGINE.parse("\\b").tree().orElseThrow());
        assertEquals(CharRange.literal('\f'), ENGINE.parse("\\f").tree().orElseThrow());
        assertEquals(CharRange.literal('\r'), ENGINE.parse("\\r").tree().orElseThrow());
        assertEquals(CharRange.literal('\t'), ENGINE.parse("\\t").tree().orElseThrow());
    }

    @Test
    void parse_escapedOperators_areLiterals() {
        for (char c : "|*+?().\\x".toCharArray()) {
            var result = ENGINE.parse("\\" + c);

            assertEquals(CharRange.literal(c), result.tree().orElseThrow(), "escaped " + c);
        }
    }

    @Test
    void unescape_unknownChar_mapsToItself() {
        assertEquals('q', RegexEngine.unescape('q'));
        assertEquals('\n', RegexEngine.unescape('n'));
    }

    @Test
    void parse_ampersand_isLiteral() {
        assertEquals(CharRange.literal('&'), ENGINE.parse("&").tree().orElseThrow());
    }

    // === Postfix, sequence, alternation ===

    @Test
    void parse_postfixOperators_wrapAtom() {
        for (var atom : List.of("a", ".", "\\t", "(a|b)", "(xy)")) {
            var plain = ENGINE.parse(atom).tree().orElseThrow();

            assertEquals(new OneOrMore(plain), ENGINE.parse(atom + "+").tree().orElseThrow());
            assertEquals(new RegexNode.Optional(plain), ENGINE.parse(atom + "?").tree().orElseThrow());
            assertEquals(new ZeroOrMore(plain), ENGINE.parse(atom + "*").tree().orElseThrow());
        }
    }

    @Test
    void parse_concatenation_isRightNested() {
        var node = ENGINE.parse("abc").tree().orElseThrow();

        assertEquals(new And(lit('a'), new And(lit('b'), lit('c'))), node);
    }

    @Test
    void parse_alternation_keepsBothBranches() {
        var node = ENGINE.parse("ab|c*").tree().orElseThrow();

        assertEquals(new Or(new And(lit('a'), lit('b')), new ZeroOrMore(lit('c'))), node);
    }

    @Test
    void parsePrefix_thirdAlternative_isLeftUnparsed() {
        var result = (ParseResult.Success) ENGINE.parsePrefix("a|b|c");

        assertEquals(new Or(lit('a'), lit('b')), result.node());
        assertEquals(3, result.consumed());
    }

    @Test
    void parsePrefix_emptyRightAlternative_restoresBeforeBar() {
        var result = (ParseResult.Success) ENGINE.parsePrefix("a|");

        assertEquals(lit('a'), result.node());
        assertEquals(1, result.consumed());
    }

    @Test
    void parsePrefix_leadingBar_fails() {
        assertTrue(ENGINE.parsePrefix("|a").isFailure());
    }

    @Test
    void parse_grouping_isTransparent() {
        for (var expr : List.of("a", "ab", "a|b", "(a)", "a*b+", ".?", "c|d(f?|g)")) {
            var plain = ENGINE.parse(expr).tree().orElseThrow();

            assertEquals(plain, ENGINE.parse("(" + expr + ")").tree().orElseThrow(), expr);
        }
    }

    @Test
    void parse_groupingLongConcatenation_buildsEqualTrees() {
        var expr = "ab".repeat(50_000);

        var plain = ENGINE.parse(expr).tree().orElseThrow();
        var grouped = ENGINE.parse("(" + expr + ")").tree().orElseThrow();

        assertEquals(plain, grouped);
        assertEquals(plain.hashCode(), grouped.hashCode());
        assertNotEquals(plain, ENGINE.parse(expr + "c").tree().orElseThrow());
        assertEquals("AND[CHAR a b, AND]", plain.toString());
    }

    @Test
    void parse_emptyGroup_fails() {
        assertTrue(ENGINE.parse("()").isFailure());
    }

    // === Rule contracts ===

    @Test
    void rules_onFailure_leaveCursorAtStart() {
        List<BiFunction<RegexEngine.Rules, SourceLocation, ParseResult>> ruleSet = List.of(
            RegexEngine.Rules::alternation,
            RegexEngine.Rules::sequence,
            RegexEngine.Rules::postfix,
            RegexEngine.Rules::atom,
            RegexEngine.Rules::group,
            RegexEngine.Rules::wildcard,
            RegexEngine.Rules::literal
        );

        for (var sample : SAMPLES) {
            for (var rule : ruleSet) {
                var rules = new RegexEngine.Rules(sample, ParserConfig.DEFAULT);
                var result = rule.apply(rules, SourceLocation.START);

                if (result.isFailure()) {
                    assertEquals(SourceLocation.START, rules.cursor().location(), "input '" + sample + "'");
                }
            }
        }
    }

    @Test
    void rules_onSuccess_consumeExactlyMatchedText() {
        for (var sample : SAMPLES) {
            var rules = new RegexEngine.Rules(sample, ParserConfig.DEFAULT);
            var result = rules.alternation(SourceLocation.START);

            if (result instanceof ParseResult.Success success) {
                var cursor = rules.cursor();
                assertEquals(success.end(), cursor.location());
                assertEquals(sample, success.span().extract(sample) + cursor.remainingInput());
            }
        }
    }

    @Test
    void rules_fromInnerLocation_parseSuffix() {
        var rules = new RegexEngine.Rules("xy|z", ParserConfig.DEFAULT);
        var start = SourceLocation.at(1, 2, 1);

        var result = (ParseResult.Success) rules.alternation(start);

        assertEquals(new Or(lit('y'), lit('z')), result.node());
        assertEquals(start, result.span().start());
        assertEquals(4, result.end().offset());
    }

    // === Error reporting ===

    @Test
    void parse_missingCloseParen_reportsFurthestExpectation() {
        var result = ENGINE.parse("a(b");

        var error = result.error().orElseThrow();
        assertInstanceOf(ParseError.UnexpectedEof.class, error);
        assertEquals(3, error.location().offset());
        assertThat(((ParseError.UnexpectedEof) error).expected()).contains("')'");
    }

    @Test
    void parse_unbalancedCloseParen_reportsTrailingInput() {
        var error = ENGINE.parse("ab)c").error().orElseThrow();

        assertEquals(new ParseError.TrailingInput(SourceLocation.at(1, 3, 2), ")c"), error);
    }

    @Test
    void parse_unexpectedChar_mergesExpectations() {
        var error = ENGINE.parse("*").error().orElseThrow();

        assertInstanceOf(ParseError.UnexpectedInput.class, error);
        var unexpected = (ParseError.UnexpectedInput) error;
        assertEquals("*", unexpected.found());
        assertThat(unexpected.expected()).contains("'('", "'.'", "character");
    }

    // === Trailing backslash ===

    @Test
    void parsePrefix_trailingBackslash_stopsBeforeIt() {
        var result = (ParseResult.Success) ENGINE.parsePrefix("ab\\");

        assertEquals(new And(lit('a'), lit('b')), result.node());
        assertEquals(2, result.consumed());
    }

    @Test
    void parse_trailingBackslash_reportsDanglingEscape() {
        var error = ENGINE.parse("ab\\").error().orElseThrow();

        assertEquals(new ParseError.DanglingEscape(SourceLocation.at(1, 3, 2)), error);
    }

    @Test
    void literal_loneBackslash_restoresCursor() {
        var rules = new RegexEngine.Rules("\\", ParserConfig.DEFAULT);

        var result = rules.literal(SourceLocation.START);

        assertTrue(result.isFailure());
        assertEquals(0, rules.cursor().pos());
    }

    @Test
    void parsePrefix_strictEscapes_abortsOnTrailingBackslash() {
        var strict = RegexEngine.create(new ParserConfig(16, 100, true));

        var result = strict.parsePrefix("ab\\");

        assertInstanceOf(ParseResult.Fatal.class, result);
        assertInstanceOf(ParseError.DanglingEscape.class, result.error().orElseThrow());
    }

    // === Limits ===

    @Test
    void parse_nestingWithinLimit_succeeds() {
        var engine = RegexEngine.create(new ParserConfig(3, 100, false));

        assertEquals(lit('a'), engine.parse("(((a)))").tree().orElseThrow());
    }

    @Test
    void parse_nestingBeyondLimit_failsWithNestingError() {
        var engine = RegexEngine.create(new ParserConfig(3, 100, false));

        var result = engine.parsePrefix("x((((a))))");

        assertInstanceOf(ParseResult.Fatal.class, result);
        var error = (ParseError.NestingTooDeep) result.error().orElseThrow();
        assertEquals(3, error.limit());
        assertEquals(4, error.location().offset());
    }

    @Test
    void parse_deeplyNestedDefaultLimit_failsWithoutStackOverflow() {
        var pattern = "(".repeat(100_000) + "a" + ")".repeat(100_000);

        var result = ENGINE.parse(pattern);

        assertInstanceOf(ParseError.NestingTooDeep.class, result.error().orElseThrow());
    }

    @Test
    void parse_longConcatenation_succeeds() {
        var pattern = "ab".repeat(50_000);

        var result = ENGINE.parse(pattern);

        assertTrue(result.isSuccess());
        assertEquals(pattern.length(), ((ParseResult.Success) result).consumed());
    }

    @Test
    void parse_inputOverLimit_failsBeforeParsing() {
        var engine = RegexEngine.create(new ParserConfig(8, 4, false));

        var result = engine.parse("abcde");

        assertEquals(new ParseError.InputTooLong(SourceLocation.START, 5, 4), result.error().orElseThrow());
        assertTrue(engine.parse("abcd").isSuccess());
    }

    @Test
    void parse_nullPattern_throws() {
        assertThrows(NullPointerException.class, () -> ENGINE.parse(null));
    }

    private static CharRange lit(char c) {
        return CharRange.literal(c);
    }
}
