package com.archsketch.core.walker;

import com.archsketch.core.model.SyntaxNode;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Pre-order, depth-first traversal over {@link SyntaxNode} trees.
 *
 * <p>Traversal uses an explicit worklist of {@code (node, context)} frames instead of
 * recursion, so tree depth is bounded by heap rather than by the thread stack. Children
 * are pushed in reverse so they are popped in source order, which keeps the visiting order
 * identical to a recursive pre-order walk.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * TreeWalker.walk(root, null, (node, enclosing) -> {
 *     if (isComponent(node)) {
 *         return nameOf(node);   // becomes the context of the subtree
 *     }
 *     return enclosing;          // propagate unchanged
 * });
 * }</pre>
 */
public final class TreeWalker {

    private TreeWalker() {
        // Utility class
    }

    /**
     * Walks the tree, threading a context from each node to its children.
     *
     * @param root root node
     * @param initialContext context of the root, may be {@code null}
     * @param visitor callback returning the context for the visited node's children
     * @param <C> context type
     */
    public static <C> void walk(SyntaxNode root, C initialContext, NodeVisitor<C> visitor) {
        Objects.requireNonNull(root, "root must not be null");
        Objects.requireNonNull(visitor, "visitor must not be null");

        Deque<Frame<C>> stack = new ArrayDeque<>();
        stack.push(new Frame<>(root, initialContext));
        while (!stack.isEmpty()) {
            Frame<C> frame = stack.pop();
            C childContext = visitor.visit(frame.node(), frame.context());
            pushChildren(stack, frame.node().children(), childContext);
        }
    }

    /**
     * Walks the tree without a context.
     *
     * @param root root node
     * @param action callback for every node
     */
    public static void walk(SyntaxNode root, Consumer<SyntaxNode> action) {
        Objects.requireNonNull(action, "action must not be null");
        walk(root, null, (node, ignored) -> {
            action.accept(node);
            return null;
        });
    }

    /**
     * Finds the first descendant, in pre-order, that satisfies the predicate.
     *
     * <p>The start node itself is not tested.
     *
     * @param node start node
     * @param predicate condition to satisfy
     * @return first matching descendant, or empty
     */
    public static Optional<SyntaxNode> findFirstDescendant(SyntaxNode node, Predicate<SyntaxNode> predicate) {
        Objects.requireNonNull(node, "node must not be null");
        Deque<Frame<Void>> stack = new ArrayDeque<>();
        pushChildren(stack, node.children(), null);
        while (!stack.isEmpty()) {
            SyntaxNode current = stack.pop().node();
            if (predicate.test(current)) {
                return Optional.of(current);
            }
            pushChildren(stack, current.children(), null);
        }
        return Optional.empty();
    }

    /**
     * Concatenates the text of all leaves under a node, in source order.
     *
     * <p>Renders small type expressions such as {@code *Buffer} or {@code <-chan int} that
     * tree-sitter splits into several tokens. A space is inserted only between two tokens
     * that would otherwise fuse into one word.
     *
     * @param node start node
     * @return joined leaf text, empty if no leaf carries text
     */
    public static String joinLeafText(SyntaxNode node) {
        StringBuilder joined = new StringBuilder();
        walk(node, current -> {
            if (!current.isLeaf() || !current.hasText() || current.text().isEmpty()) {
                return;
            }
            String token = current.text();
            if (joined.length() > 0
                && isWordChar(joined.charAt(joined.length() - 1))
                && isWordChar(token.charAt(0))) {
                joined.append(' ');
            }
            joined.append(token);
        });
        return joined.toString();
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private static <C> void pushChildren(Deque<Frame<C>> stack, List<SyntaxNode> children, C context) {
        for (int i = children.size() - 1; i >= 0; i--) {
            stack.push(new Frame<>(children.get(i), context));
        }
    }

    private record Frame<C>(SyntaxNode node, C context) {
    }
}
