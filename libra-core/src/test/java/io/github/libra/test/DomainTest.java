package io.github.libra.test;

import io.github.libra.core.domain.*;
import io.github.libra.core.ir.RegisterSlot;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

public class DomainTest {
    /**
     * Check the lattice laws every domain must satisfy on all pairs of the given samples.
     */
    public static <D extends AbstractDomain<D>> void checkLaws(List<D> samples) {
        for (D a : samples) {
            assertEquals(PartialOrder.EQUAL, a.compare(a), a::toString);
            assertEquals(a, a.join(a));
            assertTrue(a.bottom().compare(a).isLessOrEqual(), a::toString);
            for (D b : samples) {
                String pair = a + ", " + b;
                D join = a.join(b);
                assertEquals(join, b.join(a), pair);
                assertTrue(a.compare(join).isLessOrEqual(), pair);
                assertTrue(b.compare(join).isLessOrEqual(), pair);
                assertEquals(a.compare(b).reverse(), b.compare(a), pair);
                assertEquals(a.equals(b), a.compare(b) == PartialOrder.EQUAL, pair);

                D widened = a.widen(b);
                assertTrue(a.compare(widened).isLessOrEqual(), pair);
                assertTrue(b.compare(widened).isLessOrEqual(), pair);
                for (D c : samples) {
                    assertTrue(widened.narrow(c).compare(widened).isLessOrEqual(), pair + ", " + c);
                }
            }
        }
    }

    @Test
    void testFiniteSet() {
        FiniteSetDomain<Integer> none = FiniteSetDomain.empty();
        FiniteSetDomain<Integer> one = FiniteSetDomain.of(1);
        FiniteSetDomain<Integer> two = FiniteSetDomain.of(2);
        FiniteSetDomain<Integer> both = FiniteSetDomain.of(1, 2);
        checkLaws(Arrays.asList(none, one, two, both, FiniteSetDomain.of(2, 3)));

        assertEquals(both, one.join(two));
        assertEquals(both, one.with(2));
        assertSame(one, one.with(1));
        assertEquals(PartialOrder.LESS, one.compare(both));
        assertEquals(PartialOrder.INCOMPARABLE, one.compare(two));
        assertEquals(one, both.narrow(one));
        assertEquals(none, one.bottom());
        assertTrue(both.contains(2));
        assertFalse(one.contains(2));
    }

    @Test
    void testMap() {
        MapDomain<String, FiniteSetDomain<Integer>> empty = MapDomain.empty();
        MapDomain<String, FiniteSetDomain<Integer>> a = empty.with("x", FiniteSetDomain.of(1));
        MapDomain<String, FiniteSetDomain<Integer>> b = empty.with("y", FiniteSetDomain.of(2));
        MapDomain<String, FiniteSetDomain<Integer>> c = a.with("y", FiniteSetDomain.of(3));
        checkLaws(Arrays.asList(empty, a, b, c, a.join(b)));

        // a missing key is below any value at that key
        assertEquals(PartialOrder.LESS, a.compare(c));
        assertEquals(PartialOrder.INCOMPARABLE, a.compare(b));
        assertEquals(FiniteSetDomain.of(2, 3), b.join(c).get("y"));
        assertNull(a.get("y"));
        assertEquals(a, c.narrow(a));
        assertEquals(c, MapDomain.of(c.map));
        assertEquals(empty, MapDomain.of(new java.util.HashMap<String, FiniteSetDomain<Integer>>()));
        assertTrue(empty.map.isEmpty());
    }

    @Test
    void testPair() {
        PairDomain<FiniteSetDomain<Integer>, FiniteSetDomain<String>> bottom =
                PairDomain.of(FiniteSetDomain.empty(), FiniteSetDomain.empty());
        PairDomain<FiniteSetDomain<Integer>, FiniteSetDomain<String>> left =
                PairDomain.of(FiniteSetDomain.of(1), FiniteSetDomain.empty());
        PairDomain<FiniteSetDomain<Integer>, FiniteSetDomain<String>> right =
                PairDomain.of(FiniteSetDomain.empty(), FiniteSetDomain.of("a"));
        checkLaws(Arrays.asList(bottom, left, right, left.join(right)));

        assertEquals(PartialOrder.INCOMPARABLE, left.compare(right));
        assertEquals(PairDomain.of(FiniteSetDomain.of(1), FiniteSetDomain.of("a")), left.join(right));
        assertEquals(bottom, left.bottom());
    }

    @Test
    void testRegisterSlot() {
        RegisterSlot slot = RegisterSlot.of(4);
        checkLaws(Arrays.asList(RegisterSlot.BOTTOM, slot));

        assertEquals(slot, RegisterSlot.BOTTOM.join(slot));
        assertEquals(PartialOrder.INCOMPARABLE, slot.compare(RegisterSlot.of(5)));
        assertThrows(IllegalArgumentException.class, () -> slot.join(RegisterSlot.of(5)));
        assertThrows(IllegalArgumentException.class, () -> RegisterSlot.of(Integer.MAX_VALUE));
        assertTrue(RegisterSlot.of(1).compareTo(slot) < 0);
    }

    @Test
    void testPartialOrder() {
        assertEquals(PartialOrder.LESS, PartialOrder.EQUAL.combine(PartialOrder.LESS));
        assertEquals(PartialOrder.INCOMPARABLE, PartialOrder.LESS.combine(PartialOrder.GREATER));
        assertEquals(PartialOrder.GREATER, PartialOrder.ofInclusion(false, true));
        assertTrue(PartialOrder.EQUAL.isLessOrEqual());
        assertFalse(PartialOrder.INCOMPARABLE.isGreaterOrEqual());
    }
}
