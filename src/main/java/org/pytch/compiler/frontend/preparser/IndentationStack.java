package org.pytch.compiler.frontend.preparser;

import java.util.ArrayList;
import java.util.List;

/**
 * The preparser's stack of open layout contexts. Entries are ordered by creation, so
 * an entry's line is never smaller than the line of any entry beneath it.
 */
public class IndentationStack {

    private final List<IndentationStackEntry> entries = new ArrayList<>();

    /**
     * Pushes an entry.
     * @param entry The entry to push.
     * @throws IllegalStateException if the entry's line precedes the line of the current top.
     */
    public void push(IndentationStackEntry entry) {
        if (!entries.isEmpty() && entry.line() < peek().line()) {
            throw new IllegalStateException("Entry for line " + entry.line()
                    + " pushed above an entry for line " + peek().line());
        }
        entries.add(entry);
    }

    /**
     * Removes and returns the top entry.
     * @return The former top entry.
     * @throws IllegalStateException if the stack is empty.
     */
    public IndentationStackEntry pop() {
        if (entries.isEmpty()) {
            throw new IllegalStateException("Pop from an empty indentation stack");
        }
        return entries.remove(entries.size() - 1);
    }

    /**
     * @return The top entry, or {@code null} if the stack is empty.
     */
    public IndentationStackEntry peek() {
        return entries.isEmpty() ? null : entries.get(entries.size() - 1);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int depth() {
        return entries.size();
    }
}
