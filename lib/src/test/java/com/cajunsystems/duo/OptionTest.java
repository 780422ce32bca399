package com.cajunsystems.duo;

import com.cajunsystems.duo.data.Either;
import com.cajunsystems.duo.data.Unit;
import com.cajunsystems.duo.exception.InvalidUnwrapException;
import com.cajunsystems.duo.exception.OptionUnwrapException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

class OptionTest {

    @Test
    void testConstruction() {
        Option<Integer> some = Option.some(42);
        Option<Integer> none = Option.none();

        assertTrue(some.isSome());
        assertFalse(some.isNone());
        assertTrue(none.isNone());
        assertFalse(none.isSome());
    }

    @Test
    void testSomeRejectsNull() {
        assertThrows(NullPointerException.class, () -> Option.some(null));
    }

    @Test
    void testOfNullable() {
        String missing = null;

        assertEquals(Option.none(), Option.ofNullable(missing));
        assertEquals(Option.some("here"), Option.ofNullable("here"));
    }

    @Test
    void testReduceReturnsValueOrAlternative() {
        assertEquals(7, Option.some(7).reduce(0));
        assertEquals(0, Option.<Integer>none().reduce(0));
    }

    @Test
    void testReduceWithSupplierIsLazy() {
        AtomicInteger calls = new AtomicInteger(0);

        Integer present = Option.some(7).reduce(() -> calls.incrementAndGet());
        Integer absent = Option.<Integer>none().reduce(() -> calls.incrementAndGet() + 100);

        assertEquals(7, present);
        assertEquals(101, absent);
        assertEquals(1, calls.get());
    }

    @Test
    void testReduceWithFunctionOfNothing() {
        Integer absent = Option.<Integer>none().reduce((Unit nothing) -> -1);
        assertEquals(-1, absent);
    }

    @Test
    void testReduceRejectsNullAlternativeFunction() {
        Function<Unit, Integer> missing = null;

        NullPointerException thrown = assertThrows(NullPointerException.class, () -> Option.some(1).reduce(missing));

        assertEquals("alternative", thrown.getMessage());
    }

    @Test
    void testMatch() {
        String some = Option.some(3).match(x -> "some " + x, () -> "none");
        String none = Option.<Integer>none().match(x -> "some " + x, () -> "none");

        assertEquals("some 3", some);
        assertEquals("none", none);
    }

    @Test
    void testMatchAsTwoCaseContainer() {
        Matchable<Integer, Unit> matchable = Option.<Integer>none();

        String result = matchable.match(x -> "some", nothing -> "none " + nothing);

        assertEquals("none ()", result);
    }

    @Test
    void testMapTransformsPresentValue() {
        assertEquals(Option.some(4), Option.some(2).map(x -> x * 2));
    }

    @Test
    void testMapNeverCallsFunctionOnNone() {
        AtomicBoolean called = new AtomicBoolean(false);

        Option<Integer> result = Option.<Integer>none().map(x -> {
            called.set(true);
            return x * 2;
        });

        assertTrue(result.isNone());
        assertFalse(called.get());
    }

    @Test
    void testMapToNullYieldsNone() {
        Option<String> result = Option.some(1).map(x -> (String) null);
        assertTrue(result.isNone());
    }

    @Test
    void testMapIdentityLaw() {
        Option<Integer> some = Option.some(5);
        Option<Integer> none = Option.none();

        assertEquals(some, some.map(Function.identity()));
        assertEquals(none, none.map(Function.identity()));
    }

    @Test
    void testMapCompositionLaw() {
        Function<Integer, Integer> f = x -> x + 1;
        Function<Integer, String> g = x -> "n" + x;
        Option<Integer> some = Option.some(5);
        Option<Integer> none = Option.none();

        assertEquals(some.map(f).map(g), some.map(x -> g.apply(f.apply(x))));
        assertEquals(none.map(f).map(g), none.map(x -> g.apply(f.apply(x))));
    }

    @Test
    void testFilter() {
        Option<Integer> even = Option.some(4).filter(x -> x % 2 == 0);
        Option<Integer> odd = Option.some(3).filter(x -> x % 2 == 0);

        assertEquals(Option.some(4), even);
        assertTrue(odd.isNone());
    }

    @Test
    void testFilterOnNoneSkipsPredicate() {
        AtomicBoolean called = new AtomicBoolean(false);

        Option<Integer> result = Option.<Integer>none().filter(x -> {
            called.set(true);
            return true;
        });

        assertTrue(result.isNone());
        assertFalse(called.get());
    }

    @Test
    void testBind() {
        Function<Integer, Option<Integer>> half = x -> x % 2 == 0 ? Option.some(x / 2) : Option.none();

        assertEquals(Option.some(5), Option.some(10).bind(half));
        assertTrue(Option.some(3).bind(half).isNone());
    }

    @Test
    void testBindShortCircuitsOnNone() {
        AtomicBoolean called = new AtomicBoolean(false);

        Option<String> result = Option.<Integer>none().bind(x -> {
            called.set(true);
            return Option.some("never");
        });

        assertTrue(result.isNone());
        assertFalse(called.get());
    }

    @Test
    void testUnwrap() {
        assertEquals(9, Option.some(9).unwrap());

        OptionUnwrapException thrown = assertThrows(
                OptionUnwrapException.class,
                () -> Option.none().unwrap()
        );
        assertInstanceOf(InvalidUnwrapException.class, thrown);
        assertTrue(thrown.getMessage().contains("isSome"));
    }

    @Test
    void testTapReturnsSameOption() {
        List<String> effects = new ArrayList<>();
        Option<Integer> some = Option.some(1);
        Option<Integer> none = Option.none();

        assertSame(some, some.tap(x -> effects.add("some " + x), () -> effects.add("none")));
        assertSame(none, none.tap(x -> effects.add("some " + x), () -> effects.add("none")));

        assertEquals(List.of("some 1", "none"), effects);
    }

    @Test
    void testEffectReturnsUnit() {
        List<String> effects = new ArrayList<>();

        Unit result = Option.some("a").effect(effects::add, () -> effects.add("none"));

        assertEquals(Unit.unit(), result);
        assertEquals(List.of("a"), effects);
    }

    @Test
    void testTapSomeRunsEveryConsumerInOrder() {
        List<String> effects = new ArrayList<>();

        Option.some("x").tapSome(v -> effects.add("first " + v), v -> effects.add("second " + v));
        Option.<String>none().tapSome(v -> effects.add("never"));

        assertEquals(List.of("first x", "second x"), effects);
    }

    @Test
    void testTapNoneAndEffectNone() {
        List<String> effects = new ArrayList<>();

        Option.<String>none().tapNone(() -> effects.add("tap"));
        Option.<String>none().effectNone(() -> effects.add("effect"));
        Option.some("x").tapNone(() -> effects.add("never"));

        assertEquals(List.of("tap", "effect"), effects);
    }

    @Test
    void testOptionalConversions() {
        assertEquals(Optional.of(1), Option.some(1).toOptional());
        assertEquals(Optional.empty(), Option.none().toOptional());
        assertEquals(Option.some("v"), Option.fromOptional(Optional.of("v")));
        assertTrue(Option.fromOptional(Optional.empty()).isNone());
    }

    @Test
    void testToResult() {
        Result<Integer, String> present = Option.some(1).toResult(() -> "missing");
        Result<Integer, String> absent = Option.<Integer>none().toResult(() -> "missing");

        assertEquals(Result.success(1), present);
        assertEquals(Result.failure("missing"), absent);
    }

    @Test
    void testToEither() {
        Either<Integer, Unit> some = Option.some(1).toEither();
        Either<Integer, Unit> none = Option.<Integer>none().toEither();

        assertEquals(Either.left(1), some);
        assertEquals(Either.right(Unit.unit()), none);
    }
}
