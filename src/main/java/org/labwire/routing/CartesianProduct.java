package org.labwire.routing;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Lazy Cartesian product in canonical order: the first dimension varies slowest.
 *
 * <p>Elements are pulled from each dimension's iterator only when the odometer first
 * reaches them and are cached for later passes, so no dimension is consumed twice and a
 * dimension is never drained further than the product needs. A product with no dimensions
 * yields one empty tuple; a product with an empty dimension yields nothing.</p>
 *
 * @param <T> element type.
 */
final class CartesianProduct<T> implements Iterator<List<T>> {
    private final List<Iterator<? extends T>> sources;
    private final List<List<T>> cache;
    private final int[] indices;
    private boolean started;
    private boolean pending;
    private boolean exhausted;

    CartesianProduct(List<? extends Iterator<? extends T>> dimensions) {
        this.sources = new ArrayList<>(dimensions);
        this.cache = new ArrayList<>(dimensions.size());
        for (int i = 0; i < dimensions.size(); i++) {
            cache.add(new ArrayList<>());
        }
        this.indices = new int[dimensions.size()];
    }

    static <T> CartesianProduct<T> ofLists(List<? extends List<? extends T>> dimensions) {
        List<Iterator<? extends T>> iterators = new ArrayList<>(dimensions.size());
        for (List<? extends T> dimension : dimensions) {
            iterators.add(dimension.iterator());
        }
        return new CartesianProduct<>(iterators);
    }

    @Override
    public boolean hasNext() {
        if (exhausted) {
            return false;
        }
        if (!pending) {
            pending = started ? advance() : start();
            started = true;
            exhausted = !pending;
        }
        return pending;
    }

    @Override
    public List<T> next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        pending = false;
        List<T> tuple = new ArrayList<>(indices.length);
        for (int d = 0; d < indices.length; d++) {
            tuple.add(cache.get(d).get(indices[d]));
        }
        return tuple;
    }

    private boolean start() {
        for (int d = 0; d < indices.length; d++) {
            if (!available(d, 0)) {
                return false;
            }
        }
        return true;
    }

    private boolean advance() {
        for (int d = indices.length - 1; d >= 0; d--) {
            if (available(d, indices[d] + 1)) {
                indices[d]++;
                for (int later = d + 1; later < indices.length; later++) {
                    indices[later] = 0;
                }
                return true;
            }
        }
        return false;
    }

    private boolean available(int dimension, int index) {
        List<T> cached = cache.get(dimension);
        if (index < cached.size()) {
            return true;
        }
        Iterator<? extends T> source = sources.get(dimension);
        if (source.hasNext()) {
            cached.add(source.next());
            return true;
        }
        return false;
    }
}
