package util;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * FIFO work queue that ignores elements already waiting in it. Used by the fixpoint engine so a block whose inputs
 * change several times before it is processed is only processed once.
 *
 * @param <T>
 *            type of queue elements
 */
public class WorkQueue<T> {

    /**
     * Elements in processing order
     */
    private final Deque<T> q = new ArrayDeque<>();
    /**
     * Mirror of q for fast containment checks
     */
    private final Set<T> members = new HashSet<>();

    /**
     * Create an empty queue
     */
    public WorkQueue() {
    }

    /**
     * Create a queue containing the given elements in iteration order
     *
     * @param c
     *            initial elements of the queue
     */
    public WorkQueue(Collection<? extends T> c) {
        addAll(c);
    }

    /**
     * Add n to the back of the queue unless it is already waiting
     *
     * @param n
     *            element to add
     * @return true if n was not already in the queue
     */
    public boolean add(T n) {
        boolean added = members.add(n);
        if (added) {
            q.addLast(n);
        }
        return added;
    }

    /**
     * Add elements to the back of the queue
     *
     * @param c
     *            elements to add
     * @return true if the queue changed
     */
    public boolean addAll(Collection<? extends T> c) {
        boolean changed = false;
        for (T n : c) {
            changed |= add(n);
        }
        return changed;
    }

    /**
     * Get and remove the element at the front of the queue
     *
     * @return the next element or null if the queue is empty
     */
    public T poll() {
        T n = q.pollFirst();
        if (n != null) {
            members.remove(n);
        }
        return n;
    }

    public boolean contains(T n) {
        return members.contains(n);
    }

    public boolean isEmpty() {
        return q.isEmpty();
    }

    public int size() {
        return q.size();
    }

    @Override
    public String toString() {
        return q.toString();
    }
}
