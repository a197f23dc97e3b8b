package org.pragmatica.combinator.parser;

import org.junit.jupiter.api.Test;
import org.pragmatica.combinator.error.ParseError;
import org.pragmatica.combinator.text.Cursor;
import org.pragmatica.combinator.text.StringText;
import org.pragmatica.combinator.text.Text;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.pragmatica.combinator.parser.Combinators.*;
import static org.pragmatica.combinator.parser.Primitives.*;
import static org.pragmatica.combinator.parser.PrimitivesTest.run;
import static org.pragmatica.combinator.parser.PrimitivesTest.success;

class CombinatorsTest {

    private static final Recognizer<Character, Character> DIGIT = satisfy(Character::isDigit, "digit");

    // === Sequence ===

    @Test
    void sequence_allPartsMatch_producesOrderedValues() {
        var parser = Combinators.<Character, Character>sequence(literal('a'), literal('b'), literal('c'));

        var success = success(run(parser, "abcd"));

        assertEquals(List.of('a', 'b', 'c'), success.value());
        assertEquals(3, success.next().offset());
    }

    @Test
    void sequence_partFails_propagatesKind() {
        var parser = Combinators.<Character, Character>sequence(literal('a'), literal('b'));

        assertEquals(Match.failure(ParseError.NO_MATCH), run(parser, "ax"));
        assertEquals(Match.failure(ParseError.END_OF_TEXT), run(parser, "a"));
    }

    @Test
    void sequence_failsFast_withoutTryingLaterParts() {
        var attempts = new ArrayList<Integer>();
        Recognizer<Character, Character> probe = (text, cursor) -> {
            attempts.add(cursor.offset());
            return Primitives.<Character>any().recognize(text, cursor);
        };
        var parser = Combinators.<Character, Character>sequence(literal('a'), literal('b'), probe);

        assertTrue(run(parser, "axz").isFailure());
        assertTrue(attempts.isEmpty());
    }

    @Test
    void sequence_empty_succeedsWithoutConsuming() {
        var success = success(run(Combinators.<Character, Object>sequence(List.of()), "abc"));

        assertEquals(List.of(), success.value());
        assertEquals(0, success.next().offset());
    }

    // === Alternative ===

    @Test
    void alternative_firstMatchingBranchWins() {
        var parser = Combinators.<Character, Character>alternative(literal('a'), literal('b'));

        assertEquals('b', run(parser, "bcd").unwrap());
    }

    @Test
    void alternative_reusedInSequence() {
        var letter = Combinators.<Character, Character>alternative(literal('a'), literal('b'), literal('c'));
        var parser = Combinators.<Character, Character>sequence(letter, letter);

        assertEquals(List.of('a', 'b'), run(parser, "abc").unwrap());
    }

    @Test
    void alternative_everyBranchStartsAtOriginalCursor() {
        var ab = Combinators.<Character, Character>sequence(literal('a'), literal('b'));
        var ac = Combinators.<Character, Character>sequence(literal('a'), literal('c'));
        var parser = Combinators.<Character, List<Character>>alternative(ab, ac);

        var success = success(run(parser, "ac"));

        assertEquals(List.of('a', 'c'), success.value());
        assertEquals(2, success.next().offset());
    }

    @Test
    void alternative_earlierBranchWinsTies() {
        var parser = Combinators.<Character, String>alternative(
            Primitives.<Character>any().map(c -> "first"),
            Primitives.<Character>any().map(c -> "second")
        );

        assertEquals("first", run(parser, "x").unwrap());
    }

    @Test
    void alternative_allBranchesFail_reportsNoMatch() {
        var parser = Combinators.<Character, Character>alternative(literal('a'), literal('b'));

        assertEquals(Match.failure(ParseError.NO_MATCH), run(parser, "z"));
        assertEquals(Match.failure(ParseError.NO_MATCH), run(parser, ""));
    }

    @Test
    void alternative_noBranches_rejected() {
        assertThrows(IllegalArgumentException.class, () -> Combinators.<Character, Character>alternative(List.of()));
    }

    @Test
    void or_isTwoBranchAlternative() {
        var parser = literal('x').or(literal('y'));

        assertEquals('y', run(parser, "y").unwrap());
    }

    // === Many ===

    @Test
    void many_collectsUntilFirstFailure() {
        var success = success(run(many(DIGIT), "123xyz"));

        assertEquals(List.of('1', '2', '3'), success.value());
        assertEquals(3, success.next().offset());
    }

    @Test
    void many_zeroRepetitions_succeedsAtStart() {
        var onText = success(run(many(DIGIT), "asdf"));
        var onEmpty = success(run(many(DIGIT), ""));

        assertEquals(List.of(), onText.value());
        assertEquals(0, onText.next().offset());
        assertEquals(List.of(), onEmpty.value());
    }

    @Test
    void many_partialRepetition_backtracksToLastSuccess() {
        var pair = Combinators.<Character, Character>sequence(literal('a'), literal('b'));

        var success = success(run(many(pair), "ababa"));

        assertEquals(List.of(List.of('a', 'b'), List.of('a', 'b')), success.value());
        assertEquals(4, success.next().offset());
    }

    @Test
    void many_keepsNullValues() {
        Recognizer<Character, String> nothing = Primitives.<Character>any().map(c -> null);

        var success = success(run(many(nothing), "ab"));

        assertEquals(2, success.value().size());
        assertNull(success.value().get(0));
    }

    // === Apply ===

    @Test
    void apply_transformsValueAndKeepsCursor() {
        var parser = apply(many(DIGIT), digits -> digits.size());

        var success = success(run(parser, "42!"));

        assertEquals(2, success.value());
        assertEquals(2, success.next().offset());
    }

    @Test
    void apply_onFailure_skipsFunctionAndPropagates() {
        var calls = new ArrayList<Character>();
        var parser = apply(literal('a'), c -> calls.add(c));

        assertEquals(Match.failure(ParseError.END_OF_TEXT), run(parser, ""));
        assertEquals(Match.failure(ParseError.NO_MATCH), run(parser, "b"));
        assertTrue(calls.isEmpty());
    }

    // === Lazy ===

    static final class Nested {
        // Nested <- '(' Nested ')' / 'x'
        static final Recognizer<Character, Integer> DEPTH = Combinators.<Character, Integer>alternative(
            Combinators.<Character, Object>sequence(literal('('), lazy(() -> Nested.DEPTH), literal(')'))
                       .map(values -> (Integer) values.get(1) + 1),
            literal('x').map(c -> 0)
        );
    }

    @Test
    void lazy_closesRecursiveGrammar() {
        assertEquals(0, run(Nested.DEPTH, "x").unwrap());
        assertEquals(3, run(Nested.DEPTH, "(((x)))").unwrap());
        assertTrue(run(Nested.DEPTH, "((x)").isFailure());
    }

    @Test
    void lazy_unresolved_raisesNullPointer() {
        Recognizer<Character, Character> parser = lazy(() -> null);

        assertThrows(NullPointerException.class, () -> run(parser, "x"));
    }

    // === Named ===

    @Test
    void named_behavesLikeWrappedRecognizer() {
        var parser = named("digits", many(DIGIT));

        assertEquals(List.of('7'), run(parser, "7").unwrap());
        assertEquals("digits", parser.toString());
    }

    // === Lookahead ===

    @Test
    void lookahead_successConsumesNothing() {
        var success = success(run(lookahead(literal('a')), "abc"));

        assertEquals('a', success.value());
        assertEquals(0, success.next().offset());
        assertEquals(Match.failure(ParseError.NO_MATCH), run(lookahead(literal('a')), "b"));
    }

    @Test
    void not_invertsWithoutConsuming() {
        var success = success(run(not(literal('a')), "b"));

        assertEquals(Unit.UNIT, success.value());
        assertEquals(0, success.next().offset());
        assertTrue(run(not(literal('a')), "").isSuccess());
        assertEquals(Match.failure(ParseError.NO_MATCH), run(not(literal('a')), "a"));
    }

    @Test
    void lookaheadAndNot_nullChild_rejectedAtConstruction() {
        assertThrows(NullPointerException.class, () -> lookahead(null));
        assertThrows(NullPointerException.class, () -> not(null));
    }

    // === Custom recognizers ===

    @Test
    void customRecognizer_composesWithBuiltIns() {
        var pairOfAny = new Recognizer<Character, String>() {
            @Override
            public Match<String> recognize(Text<Character> text, Cursor cursor) {
                var first = text.read(cursor);

                if (first instanceof Match.Success<Character> a) {
                    return text.read(a.next()).map(b -> "" + a.value() + b);
                }
                return first.map(String::valueOf);
            }
        };
        var text = StringText.of("abcd");

        assertEquals(List.of("ab", "cd"), many(pairOfAny).recognize(text, text.start()).unwrap());
    }
}
