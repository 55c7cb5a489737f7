/* ____  ______________  ________________________  __________
 * \   \/   /      \   \/   /   __/   /      \   \/   /      \
 *  \______/___/\___\______/___/_____/___/\___\______/___/\___\
 *
 * The MIT License (MIT)
 *
 * Copyright 2024 Vavr, https://vavr.io
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package ch.randelshofer.vavr.ordered;

import io.vavr.collection.Iterator;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.ConcurrentModificationException;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Random;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Collector;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import static ch.randelshofer.vavr.ordered.Collections.checkIndex;

/**
 * A mutable doubly-linked sequence.
 * <p>
 * Features:
 * <ul>
 *     <li>allows null elements</li>
 *     <li>is mutable</li>
 *     <li>is not thread-safe</li>
 *     <li>sorts in place with a randomized quicksort</li>
 * </ul>
 * <p>
 * Performance characteristics:
 * <ul>
 *     <li>pushFront, pushBack, popFront, popBack: O(1)</li>
 *     <li>get, set, insert, erase: O(min(i, n - i)), because the element is
 *     located by walking from the nearer end of the sequence</li>
 *     <li>sort: O(n log n) on average, O(n<sup>2</sup>) in the worst case</li>
 *     <li>iterator creation: O(1)</li>
 *     <li>iterator.next: O(1)</li>
 * </ul>
 * <p>
 * Removing from an empty sequence does not fail: {@link #popFront()} and
 * {@link #popBack()} return {@code null}. Callers that store null elements must
 * check {@link #isEmpty()} first.
 * <p>
 * Iterators fail fast with a {@link ConcurrentModificationException} if the
 * sequence is structurally modified after they were created. Cursors do not
 * check for modifications; a cursor that points to an erased element must not
 * be used anymore.
 *
 * @param <T> the element type
 */
public final class LinkedSequence<T> implements SequenceView<T> {

    private static final Random DEFAULT_RANDOM = new Random();

    @SuppressWarnings("unchecked")
    private static final Comparator<Object> NATURAL_ORDER = (a, b) -> ((Comparable<Object>) a).compareTo(b);

    private Node<T> head;
    private Node<T> tail;
    private int length;
    /**
     * Number of structural modifications: push, pop, insert, erase and clear.
     */
    private int modCount;

    /**
     * Creates an empty sequence.
     */
    public LinkedSequence() {
    }

    public static <T> LinkedSequence<T> empty() {
        return new LinkedSequence<>();
    }

    /**
     * Creates a sequence of the given elements.
     *
     * @param elements the elements
     * @param <T>      the element type
     * @return a new sequence
     * @throws NullPointerException if {@code elements} is null
     */
    @SafeVarargs
    public static <T> LinkedSequence<T> of(T... elements) {
        Objects.requireNonNull(elements, "elements is null");
        LinkedSequence<T> s = new LinkedSequence<>();
        for (T element : elements) {
            s.pushBack(element);
        }
        return s;
    }

    /**
     * Creates a sequence of the given elements.
     *
     * @param elements the elements
     * @param <T>      the element type
     * @return a new sequence
     * @throws NullPointerException if {@code elements} is null
     */
    public static <T> LinkedSequence<T> ofAll(Iterable<? extends T> elements) {
        Objects.requireNonNull(elements, "elements is null");
        LinkedSequence<T> s = new LinkedSequence<>();
        for (T element : elements) {
            s.pushBack(element);
        }
        return s;
    }

    /**
     * Returns a {@link Collector} which may be used in conjunction with
     * {@link java.util.stream.Stream#collect(Collector)} to obtain a {@link LinkedSequence}.
     *
     * @param <T> the element type
     * @return a {@link LinkedSequence} Collector
     */
    public static <T> Collector<T, ArrayList<T>, LinkedSequence<T>> collector() {
        return Collections.toListAndThen(LinkedSequence::ofAll);
    }

    // -- push and pop

    public void pushFront(T value) {
        Node<T> node = new Node<>(value);
        node.next = head;
        if (head != null) {
            head.prev = node;
        } else {
            tail = node;
        }
        head = node;
        length++;
        modCount++;
    }

    public void pushBack(T value) {
        Node<T> node = new Node<>(value);
        node.prev = tail;
        if (tail != null) {
            tail.next = node;
        } else {
            head = node;
        }
        tail = node;
        length++;
        modCount++;
    }

    /**
     * Removes and returns the first element.
     *
     * @return the first element, or {@code null} if the sequence is empty
     */
    public T popFront() {
        if (head == null) {
            return null;
        }
        Node<T> node = head;
        head = node.next;
        if (head != null) {
            head.prev = null;
        } else {
            tail = null;
        }
        node.next = null;
        length--;
        modCount++;
        return node.value;
    }

    /**
     * Removes and returns the last element.
     *
     * @return the last element, or {@code null} if the sequence is empty
     */
    public T popBack() {
        if (tail == null) {
            return null;
        }
        Node<T> node = tail;
        tail = node.prev;
        if (tail != null) {
            tail.next = null;
        } else {
            head = null;
        }
        node.prev = null;
        length--;
        modCount++;
        return node.value;
    }

    @Override
    public T peekFirst() {
        return head == null ? null : head.value;
    }

    @Override
    public T peekLast() {
        return tail == null ? null : tail.value;
    }

    // -- indexed access

    @Override
    public T get(int index) {
        return node(index).value;
    }

    /**
     * Replaces the element at the given index.
     *
     * @param index an index
     * @param value the new element
     * @return the element previously at the index
     * @throws IndexOutOfBoundsException if {@code index < 0 || index >= length()}
     */
    public T set(int index, T value) {
        Node<T> node = node(index);
        T old = node.value;
        node.value = value;
        return old;
    }

    /**
     * Inserts an element before the element at the given index.
     * <p>
     * If the index is at or past the end of the sequence, the element is appended.
     *
     * @param index an index
     * @param value the element
     * @throws IndexOutOfBoundsException if {@code index < 0}
     */
    public void insert(int index, T value) {
        if (index < 0) {
            throw new IndexOutOfBoundsException("List index is out of range: " + index);
        }
        if (index >= length) {
            pushBack(value);
            return;
        }
        Node<T> right = node(index);
        Node<T> left = right.prev;
        if (left == null) {
            pushFront(value);
            return;
        }
        Node<T> node = new Node<>(value);
        node.prev = left;
        node.next = right;
        left.next = node;
        right.prev = node;
        length++;
        modCount++;
    }

    /**
     * Removes the element at the given index.
     * <p>
     * Does nothing if the index is out of range.
     *
     * @param index an index
     * @return true if an element was removed
     */
    public boolean erase(int index) {
        if (index < 0 || index >= length) {
            return false;
        }
        Node<T> node = node(index);
        if (node.prev == null) {
            popFront();
            return true;
        }
        if (node.next == null) {
            popBack();
            return true;
        }
        Node<T> left = node.prev;
        Node<T> right = node.next;
        left.next = right;
        right.prev = left;
        node.prev = node.next = null;
        length--;
        modCount++;
        return true;
    }

    @Override
    public int indexOf(Object element) {
        int index = 0;
        for (Node<T> node = head; node != null; node = node.next, index++) {
            if (Objects.equals(node.value, element)) {
                return index;
            }
        }
        return -1;
    }

    /**
     * Removes all elements.
     */
    public void clear() {
        Node<T> node = head;
        while (node != null) {
            Node<T> next = node.next;
            node.prev = node.next = null;
            node = next;
        }
        head = tail = null;
        length = 0;
        modCount++;
    }

    @Override
    public int length() {
        return length;
    }

    private Node<T> node(int index) {
        checkIndex(index, length);
        Node<T> node;
        if (index < (length >> 1)) {
            node = head;
            for (int i = 0; i < index; i++) {
                node = node.next;
            }
        } else {
            node = tail;
            for (int i = length - 1; i > index; i--) {
                node = node.prev;
            }
        }
        return node;
    }

    // -- sort

    /**
     * Sorts the sequence in place by the natural ordering of its elements.
     *
     * @throws ClassCastException if the elements are not mutually comparable
     */
    public void sort() {
        sort(null);
    }

    /**
     * Sorts the sequence in place.
     *
     * @param comparator a comparator, or {@code null} for the natural ordering
     */
    public void sort(Comparator<? super T> comparator) {
        if (length > 1) {
            sort(0, length - 1, comparator, DEFAULT_RANDOM);
        }
    }

    /**
     * Sorts the elements in the index range {@code [low, high]} in place.
     *
     * @param low        the index of the first element of the range
     * @param high       the index of the last element of the range (inclusive)
     * @param comparator a comparator, or {@code null} for the natural ordering
     * @throws IndexOutOfBoundsException if the sequence is not empty, and
     *                                   {@code low} or {@code high} is not a valid index
     */
    public void sort(int low, int high, Comparator<? super T> comparator) {
        sort(low, high, comparator, DEFAULT_RANDOM);
    }

    /**
     * Sorts the elements in the index range {@code [low, high]} in place with a
     * randomized quicksort.
     * <p>
     * Each partition step draws its pivot index uniformly from the current range
     * with the given random source. The sort is not stable. If the comparator
     * does not impose a total order, the resulting order is unspecified.
     *
     * @param low        the index of the first element of the range
     * @param high       the index of the last element of the range (inclusive)
     * @param comparator a comparator, or {@code null} for the natural ordering
     * @param random     the source of pivot indices
     * @throws IndexOutOfBoundsException if the sequence is not empty, and
     *                                   {@code low} or {@code high} is not a valid index
     * @throws NullPointerException      if {@code random} is null
     */
    @SuppressWarnings("unchecked")
    public void sort(int low, int high, Comparator<? super T> comparator, Random random) {
        Objects.requireNonNull(random, "random is null");
        if (length == 0) {
            return;
        }
        checkIndex(low, length);
        checkIndex(high, length);
        Comparator<? super T> order = comparator != null ? comparator : (Comparator<? super T>) NATURAL_ORDER;
        Node<T> lowNode = node(low);
        Node<T> highNode = low <= high ? walk(lowNode, high - low) : lowNode;
        quicksort(lowNode, low, highNode, high, order, random);
    }

    /**
     * Sorts {@code [low, high]}, whose first and last nodes are given.
     * <p>
     * Recurses into the shorter part and loops on the longer one, which bounds
     * the recursion depth by O(log n).
     */
    private void quicksort(Node<T> lowNode, int low, Node<T> highNode, int high,
                           Comparator<? super T> comparator, Random random) {
        final Split<T> split = new Split<>();
        while (low < high) {
            partition(lowNode, low, highNode, high, comparator, random, split);
            Node<T> splitNode = split.node;
            int s = split.index;
            if (s - low < high - s) {
                quicksort(lowNode, low, splitNode, s, comparator, random);
                lowNode = splitNode.next;
                low = s + 1;
            } else {
                quicksort(splitNode.next, s + 1, highNode, high, comparator, random);
                highNode = splitNode;
                high = s;
            }
        }
    }

    /**
     * Hoare partition of {@code [low, high]}.
     * <p>
     * The pivot is swapped into {@code low} before partitioning, which keeps the
     * split in {@code [low, high - 1]}. The split index and its node are stored
     * in {@code split}.
     */
    private static <T> void partition(Node<T> lowNode, int low, Node<T> highNode, int high,
                                      Comparator<? super T> comparator, Random random, Split<T> split) {
        swapValues(lowNode, walk(lowNode, random.nextInt(high - low + 1)));
        final T pivot = lowNode.value;

        Node<T> left = null;
        Node<T> right = null;
        int i = low - 1;
        int j = high + 1;
        for (; ; ) {
            do {
                left = left == null ? lowNode : left.next;
                i++;
            } while (comparator.compare(left.value, pivot) < 0);
            do {
                right = right == null ? highNode : right.prev;
                j--;
            } while (comparator.compare(right.value, pivot) > 0);
            if (i >= j) {
                split.node = right;
                split.index = j;
                return;
            }
            swapValues(left, right);
        }
    }

    private static <T> Node<T> walk(Node<T> node, int steps) {
        for (int i = 0; i < steps; i++) {
            node = node.next;
        }
        return node;
    }

    private static final class Split<T> {
        Node<T> node;
        int index;
    }

    private static <T> void swapValues(Node<T> a, Node<T> b) {
        T value = a.value;
        a.value = b.value;
        b.value = value;
    }

    // -- iteration

    @Override
    public Iterator<T> iterator() {
        return new SequenceIterator(head, false);
    }

    @Override
    public Iterator<T> reverseIterator() {
        return new SequenceIterator(tail, true);
    }

    @Override
    public Spliterator<T> spliterator() {
        return Spliterators.spliterator(iterator(), length, Spliterator.SIZED | Spliterator.ORDERED);
    }

    @Override
    public Stream<T> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    @Override
    public Cursor<T> begin() {
        return new Cursor<>(head);
    }

    @Override
    public Cursor<T> rbegin() {
        return new Cursor<>(tail);
    }

    @Override
    public Cursor<T> end() {
        return new Cursor<>(null);
    }

    /**
     * Returns a read-only view of this sequence.
     * <p>
     * The view reflects later changes of this sequence. It cannot be cast
     * back to a {@code LinkedSequence}.
     *
     * @return a read-only view
     */
    public SequenceView<T> view() {
        return new ReadOnlyView<>(this);
    }

    // -- object methods

    @Override
    public boolean equals(Object o) {
        if (o == this) {
            return true;
        }
        if (!(o instanceof LinkedSequence<?>)) {
            return false;
        }
        LinkedSequence<?> that = (LinkedSequence<?>) o;
        if (this.length != that.length) {
            return false;
        }
        Node<?> a = this.head;
        Node<?> b = that.head;
        while (a != null) {
            if (!Objects.equals(a.value, b.value)) {
                return false;
            }
            a = a.next;
            b = b.next;
        }
        return true;
    }

    @Override
    public int hashCode() {
        int hash = 1;
        for (Node<T> node = head; node != null; node = node.next) {
            hash = 31 * hash + Objects.hashCode(node.value);
        }
        return hash;
    }

    @Override
    public String toString() {
        return iterator().mkString("LinkedSequence(", ", ", ")");
    }

    private static final class ReadOnlyView<T> implements SequenceView<T> {
        private final LinkedSequence<T> sequence;

        ReadOnlyView(LinkedSequence<T> sequence) {
            this.sequence = sequence;
        }

        @Override
        public int length() {
            return sequence.length();
        }

        @Override
        public T get(int index) {
            return sequence.get(index);
        }

        @Override
        public T peekFirst() {
            return sequence.peekFirst();
        }

        @Override
        public T peekLast() {
            return sequence.peekLast();
        }

        @Override
        public int indexOf(Object element) {
            return sequence.indexOf(element);
        }

        @Override
        public Iterator<T> iterator() {
            return sequence.iterator();
        }

        @Override
        public Iterator<T> reverseIterator() {
            return sequence.reverseIterator();
        }

        @Override
        public Spliterator<T> spliterator() {
            return sequence.spliterator();
        }

        @Override
        public Cursor<T> begin() {
            return sequence.begin();
        }

        @Override
        public Cursor<T> rbegin() {
            return sequence.rbegin();
        }

        @Override
        public Cursor<T> end() {
            return sequence.end();
        }

        @Override
        public Stream<T> stream() {
            return sequence.stream();
        }

        @Override
        public String toString() {
            return sequence.toString();
        }
    }

    private static final class Node<T> {
        T value;
        Node<T> next;
        Node<T> prev;

        Node(T value) {
            this.value = value;
        }
    }

    private final class SequenceIterator implements Iterator<T> {
        private final boolean reverse;
        private final int expectedModCount = modCount;
        private Node<T> next;

        SequenceIterator(Node<T> first, boolean reverse) {
            this.next = first;
            this.reverse = reverse;
        }

        @Override
        public boolean hasNext() {
            return next != null;
        }

        @Override
        public T next() {
            if (modCount != expectedModCount) {
                throw new ConcurrentModificationException();
            }
            if (next == null) {
                throw new NoSuchElementException("next() on empty iterator");
            }
            Node<T> current = next;
            next = reverse ? current.prev : current.next;
            return current.value;
        }
    }

    /**
     * A read-only position in a {@link LinkedSequence}.
     * <p>
     * {@link #next()} moves towards the last element, {@link #previous()} towards
     * the first. Moving past either end yields the end position, which is equal
     * to {@link LinkedSequence#end()}. Moving from the end position has no effect.
     *
     * @param <T> the element type
     */
    public static final class Cursor<T> {
        private Node<T> node;

        private Cursor(Node<T> node) {
            this.node = node;
        }

        /**
         * Returns the element at this position.
         *
         * @return the element
         * @throws NoSuchElementException if the cursor is at the end
         */
        public T get() {
            if (node == null) {
                throw new NoSuchElementException("get() on end cursor");
            }
            return node.value;
        }

        public boolean isEnd() {
            return node == null;
        }

        public Cursor<T> next() {
            if (node != null) {
                node = node.next;
            }
            return this;
        }

        public Cursor<T> previous() {
            if (node != null) {
                node = node.prev;
            }
            return this;
        }

        /**
         * Returns a new cursor at the same position.
         *
         * @return a copy of this cursor
         */
        public Cursor<T> copy() {
            return new Cursor<>(node);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Cursor<?> && ((Cursor<?>) o).node == node;
        }

        @Override
        public int hashCode() {
            return System.identityHashCode(node);
        }

        @Override
        public String toString() {
            return node == null ? "Cursor(end)" : "Cursor(" + node.value + ")";
        }
    }
}
