package io.github.eutro.pathprof.util;

import java.util.*;
import java.util.function.Function;

/**
 * A utility for walking graphs from a root, visiting each reachable node once.
 *
 * @param <T> The type of each node.
 */
public class GraphWalker<T> {
    final T root;
    final Function<T, ? extends Iterable<T>> getChildren;

    /**
     * Construct a graph walker.
     *
     * @param root        The root of the graph.
     * @param getChildren A function to get the children of each node.
     */
    public GraphWalker(T root, Function<T, ? extends Iterable<T>> getChildren) {
        this.root = root;
        this.getChildren = getChildren;
    }

    /**
     * An order over a graph.
     *
     * @param <T> The type of each node.
     */
    public interface Order<T> extends Iterable<T> {
        /**
         * Collect this order to a list.
         *
         * @return The elements of the graph, in this order.
         */
        default List<T> toList() {
            List<T> ls = new ArrayList<>();
            for (T t : this) {
                ls.add(t);
            }
            return ls;
        }

        /**
         * Collect this order to a set.
         *
         * @return The elements of the graph.
         */
        default Set<T> toSet() {
            return new LinkedHashSet<>(toList());
        }
    }

    /**
     * Get the pre-order traversal of the graph.
     *
     * @return The pre-order.
     */
    public Order<T> preOrder() {
        return PreIter::new;
    }

    private class PreIter implements Iterator<T> {
        private final List<T> stack = new ArrayList<>();
        private final Set<T> seen = new HashSet<>();

        {
            stack.add(root);
            seen.add(root);
        }

        @Override
        public boolean hasNext() {
            return !stack.isEmpty();
        }

        @Override
        public T next() {
            if (stack.isEmpty()) throw new NoSuchElementException();
            T top = stack.remove(stack.size() - 1);
            for (T next : getChildren.apply(top)) {
                if (seen.add(next)) {
                    stack.add(next);
                }
            }
            return top;
        }
    }
}
