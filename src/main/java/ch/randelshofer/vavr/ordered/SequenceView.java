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
import io.vavr.collection.List;

import java.util.stream.Stream;

/**
 * A read-only view of a {@link LinkedSequence}.
 * <p>
 * The view does not copy the elements. Changes to the underlying sequence are
 * visible through the view, and invalidate the iterators and cursors that were
 * obtained from it.
 *
 * @param <T> the element type
 */
public interface SequenceView<T> extends Iterable<T> {

    /**
     * Returns the number of elements.
     *
     * @return the length of the sequence
     */
    int length();

    default boolean isEmpty() {
        return length() == 0;
    }

    /**
     * Returns the element at the given index.
     * <p>
     * The element is located by walking from the end of the sequence that is
     * closer to the index.
     *
     * @param index an index
     * @return the element at the index
     * @throws IndexOutOfBoundsException if {@code index < 0 || index >= length()}
     */
    T get(int index);

    /**
     * Returns the first element, or {@code null} if the sequence is empty.
     *
     * @return the first element or null
     */
    T peekFirst();

    /**
     * Returns the last element, or {@code null} if the sequence is empty.
     *
     * @return the last element or null
     */
    T peekLast();

    /**
     * Returns the index of the first element that is equal to the given object.
     *
     * @param element an object
     * @return the index, or {@code -1} if no element is equal
     */
    int indexOf(Object element);

    default boolean contains(Object element) {
        return indexOf(element) >= 0;
    }

    @Override
    Iterator<T> iterator();

    /**
     * Returns an iterator that starts at the last element and moves towards the first.
     *
     * @return a reverse iterator
     */
    Iterator<T> reverseIterator();

    /**
     * Returns a cursor positioned at the first element, or at the end if the sequence is empty.
     *
     * @return a new cursor
     */
    LinkedSequence.Cursor<T> begin();

    /**
     * Returns a cursor positioned at the last element, or at the end if the sequence is empty.
     *
     * @return a new cursor
     */
    LinkedSequence.Cursor<T> rbegin();

    /**
     * Returns the end cursor. It compares equal to any cursor that has moved past
     * either end of the sequence.
     *
     * @return the end cursor
     */
    LinkedSequence.Cursor<T> end();

    Stream<T> stream();

    /**
     * Returns a snapshot of the elements as a Vavr list.
     *
     * @return a new list
     */
    default List<T> toList() {
        return List.ofAll(this);
    }
}
