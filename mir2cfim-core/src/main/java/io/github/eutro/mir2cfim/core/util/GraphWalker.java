package io.github.eutro.mir2cfim.core.util;

import io.github.eutro.mir2cfim.core.im.BlockGraph;
import io.github.eutro.mir2cfim.core.im.BlockId;

import java.util.*;

/**
 * A class for walking a graph depth-first, in pre- or post-order.
 * <p>
 * Children are visited in the order the successor function yields them, so walks are deterministic
 * whenever the successor function is.
 *
 * @param <T> The type of a node in the graph.
 */
public class GraphWalker<T> {
    /**
     * The root of the walk.
     */
    final T root;
    /**
     * The successor function.
     */
    final F<? super T, ? extends Iterable<? extends T>> getChildren;

    /**
     * Construct a graph walker from a root node and a successor function.
     *
     * @param root        The root of the graph to walk from.
     * @param getChildren The successor function of the graph.
     */
    public GraphWalker(T root, F<? super T, ? extends Iterable<? extends T>> getChildren) {
        this.root = root;
        this.getChildren = getChildren;
    }

    /**
     * Create a graph walker over the blocks of a {@link BlockGraph}, starting at its entry.
     * <p>
     * The targets of each terminator are visited in order.
     *
     * @param graph The graph.
     * @return The graph walker.
     */
    public static GraphWalker<BlockId> blockWalker(BlockGraph graph) {
        return new GraphWalker<>(graph.getEntry(), graph::successors);
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
    }

    /**
     * Get the pre-order traversal of the graph.
     *
     * @return The pre-order.
     */
    public Order<T> preOrder() {
        return () -> new DfsIter(true);
    }

    /**
     * Get the post-order traversal of the graph.
     *
     * @return The post-order.
     */
    public Order<T> postOrder() {
        return () -> new DfsIter(false);
    }

    /**
     * Get the reverse post-order of the graph. In this order, every node comes
     * before its successors, except along edges that close a cycle.
     *
     * @return The reverse post-order.
     */
    public List<T> reversePostOrder() {
        List<T> order = postOrder().toList();
        Collections.reverse(order);
        return order;
    }

    private class DfsIter implements Iterator<T> {
        private final boolean pre;
        private final Deque<T> nodes = new ArrayDeque<>();
        private final Deque<Iterator<? extends T>> children = new ArrayDeque<>();
        private final Set<T> seen = new HashSet<>();
        private T next;

        DfsIter(boolean pre) {
            this.pre = pre;
            enter(root);
            advance();
        }

        private void enter(T node) {
            seen.add(node);
            nodes.addLast(node);
            children.addLast(getChildren.apply(node).iterator());
            if (pre) next = node;
        }

        private void advance() {
            if (pre && next != null) return;
            while (!nodes.isEmpty()) {
                Iterator<? extends T> it = children.getLast();
                T child = null;
                while (it.hasNext()) {
                    T c = it.next();
                    if (!seen.contains(c)) {
                        child = c;
                        break;
                    }
                }
                if (child != null) {
                    enter(child);
                    if (pre) return;
                } else {
                    children.removeLast();
                    T done = nodes.removeLast();
                    if (!pre) {
                        next = done;
                        return;
                    }
                }
            }
        }

        @Override
        public boolean hasNext() {
            return next != null;
        }

        @Override
        public T next() {
            if (next == null) throw new NoSuchElementException();
            T ret = next;
            next = null;
            advance();
            return ret;
        }
    }
}
