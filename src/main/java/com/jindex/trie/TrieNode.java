package com.jindex.trie;

import com.jindex.index.ComparisonCounter;
import com.jindex.persistence.NodeInput;
import com.jindex.persistence.NodeOutput;
import com.jindex.persistence.PersistenceCorruptException;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Consumer;

/**
 * Trie node: children by character, plus the entries whose key ends exactly
 * here. Children are kept in character order so traversals and serialized
 * bytes are deterministic.
 *
 * @param <E> Entry type stored at key ends
 */
final class TrieNode<E> {
    final Map<Character, TrieNode<E>> children = new TreeMap<>();
    final List<E> entries = new ArrayList<>();
    boolean end;

    @FunctionalInterface
    interface EntryWriter<E> {
        void write(NodeOutput out, E entry) throws IOException;
    }

    @FunctionalInterface
    interface EntryReader<E> {
        E read(NodeInput in) throws IOException;
    }

    /**
     * Pre-order walk from {@code start}, handing out at most {@code limit}
     * entries. Counts one comparison per visited node and one per entry.
     */
    static <E> void collect(TrieNode<E> start, int limit, ComparisonCounter counter, Consumer<E> sink) {
        int taken = 0;
        Deque<TrieNode<E>> stack = new ArrayDeque<>();
        stack.push(start);
        while (!stack.isEmpty() && taken < limit) {
            TrieNode<E> node = stack.pop();
            counter.increment();
            if (node.end) {
                for (E entry : node.entries) {
                    if (taken == limit) {
                        break;
                    }
                    sink.accept(entry);
                    counter.increment();
                    taken++;
                }
            }
            List<TrieNode<E>> kids = new ArrayList<>(node.children.values());
            for (int i = kids.size() - 1; i >= 0; i--) {
                stack.push(kids.get(i));
            }
        }
    }

    /**
     * Longest root-to-leaf path in edges; 0 for a childless root.
     */
    static int height(TrieNode<?> root) {
        int height = 0;
        Deque<TrieNode<?>> nodes = new ArrayDeque<>();
        Deque<Integer> depths = new ArrayDeque<>();
        nodes.push(root);
        depths.push(0);
        while (!nodes.isEmpty()) {
            TrieNode<?> node = nodes.pop();
            int depth = depths.pop();
            height = Math.max(height, depth);
            for (TrieNode<?> child : node.children.values()) {
                nodes.push(child);
                depths.push(depth + 1);
            }
        }
        return height;
    }

    /**
     * Pre-order: each node writes its end flag, entries and child count; each
     * child is preceded by its character.
     */
    static <E> void write(TrieNode<E> root, NodeOutput out, EntryWriter<E> writer) throws IOException {
        Deque<Frame<E>> stack = new ArrayDeque<>();
        stack.push(new Frame<>(root, null, 1));
        while (!stack.isEmpty()) {
            Frame<E> frame = stack.pop();
            if (frame.label != null) {
                out.writeChar(frame.label);
            }
            out.enterNode(frame.depth);
            TrieNode<E> node = frame.node;
            out.writeBoolean(node.end);
            out.writeInt(node.entries.size());
            for (E entry : node.entries) {
                writer.write(out, entry);
            }
            out.writeInt(node.children.size());
            List<Map.Entry<Character, TrieNode<E>>> kids = new ArrayList<>(node.children.entrySet());
            for (int i = kids.size() - 1; i >= 0; i--) {
                Map.Entry<Character, TrieNode<E>> kid = kids.get(i);
                stack.push(new Frame<>(kid.getValue(), kid.getKey(), frame.depth + 1));
            }
        }
    }

    static <E> TrieNode<E> read(NodeInput in, EntryReader<E> reader) throws IOException {
        TrieNode<E> root = new TrieNode<>();
        in.enterNode(1);
        Deque<Pending<E>> stack = new ArrayDeque<>();
        stack.push(new Pending<>(root, readBody(in, root, reader), 1));
        while (!stack.isEmpty()) {
            Pending<E> top = stack.peek();
            if (top.remaining == 0) {
                stack.pop();
                continue;
            }
            top.remaining--;
            char label = in.readChar();
            TrieNode<E> child = new TrieNode<>();
            in.enterNode(top.depth + 1);
            int kids = readBody(in, child, reader);
            if (top.node.children.put(label, child) != null) {
                throw new PersistenceCorruptException("Duplicate trie edge '" + label + "'");
            }
            stack.push(new Pending<>(child, kids, top.depth + 1));
        }
        return root;
    }

    private static <E> int readBody(NodeInput in, TrieNode<E> node, EntryReader<E> reader) throws IOException {
        node.end = in.readBoolean();
        int count = in.readCount("entry");
        for (int i = 0; i < count; i++) {
            node.entries.add(reader.read(in));
        }
        return in.readCount("child");
    }

    private static final class Frame<E> {
        final TrieNode<E> node;
        final Character label;
        final int depth;

        Frame(TrieNode<E> node, Character label, int depth) {
            this.node = node;
            this.label = label;
            this.depth = depth;
        }
    }

    private static final class Pending<E> {
        final TrieNode<E> node;
        int remaining;
        final int depth;

        Pending(TrieNode<E> node, int remaining, int depth) {
            this.node = node;
            this.remaining = remaining;
            this.depth = depth;
        }
    }
}
