package org.labwire.routing;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Cartesian Product Tests")
class CartesianProductTest {

    private static <T> List<List<T>> drain(Iterator<List<T>> product) {
        List<List<T>> tuples = new ArrayList<>();
        product.forEachRemaining(tuples::add);
        return tuples;
    }

    private static Iterator<Integer> counting(List<Integer> values, AtomicInteger pulls) {
        Iterator<Integer> delegate = values.iterator();
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return delegate.hasNext();
            }

            @Override
            public Integer next() {
                pulls.incrementAndGet();
                return delegate.next();
            }
        };
    }

    @Test
    @DisplayName("First dimension varies slowest")
    void testCanonicalOrder() {
        CartesianProduct<Integer> product = CartesianProduct.ofLists(List.of(List.of(1, 2), List.of(3, 4)));

        assertEquals(List.of(List.of(1, 3), List.of(1, 4), List.of(2, 3), List.of(2, 4)), drain(product));
    }

    @Test
    @DisplayName("No dimensions yield one empty tuple; an empty dimension yields nothing")
    void testDegenerateShapes() {
        assertEquals(List.of(List.of()), drain(CartesianProduct.<Integer>ofLists(List.of())));
        assertTrue(drain(CartesianProduct.ofLists(List.of(List.of(1), List.<Integer>of()))).isEmpty());

        CartesianProduct<Integer> empty = CartesianProduct.ofLists(List.of(List.<Integer>of()));
        assertThrows(NoSuchElementException.class, empty::next);
    }

    @Test
    @DisplayName("Dimensions are pulled lazily and only once")
    void testLazyPulls() {
        AtomicInteger firstPulls = new AtomicInteger();
        AtomicInteger secondPulls = new AtomicInteger();
        CartesianProduct<Integer> product = new CartesianProduct<>(List.of(
                counting(List.of(1, 2, 3), firstPulls),
                counting(List.of(10, 20), secondPulls)
        ));

        assertEquals(List.of(1, 10), product.next());
        assertEquals(1, firstPulls.get());
        assertEquals(1, secondPulls.get());

        drain(product);
        assertEquals(3, firstPulls.get());
        assertEquals(2, secondPulls.get(), "second dimension must be replayed from cache");
    }
}
