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

import io.vavr.Tuple;
import io.vavr.Tuple2;
import io.vavr.collection.Iterator;
import io.vavr.collection.Seq;
import io.vavr.control.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InvalidObjectException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.ObjectStreamException;
import java.io.Serializable;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collector;

/**
 * Implements a mutable hash table with string keys that iterates in the order,
 * in which keys were inserted.
 * <p>
 * Features:
 * <ul>
 *     <li>allows null values, but no null keys</li>
 *     <li>is mutable</li>
 *     <li>is not thread-safe</li>
 *     <li>iterates in the order, in which keys were inserted</li>
 * </ul>
 * <p>
 * Performance characteristics:
 * <ul>
 *     <li>insert, get, apply, containsKey: O(1) on average, O(N) if all keys collide</li>
 *     <li>insert that grows the table: O(N)</li>
 *     <li>erase: O(N), because the key must be removed from the key order</li>
 *     <li>pop: O(1) on average</li>
 *     <li>iterator creation: O(1)</li>
 * </ul>
 * <p>
 * Implementation details:
 * <p>
 * The table is an array of buckets. Each bucket is a {@link LinkedSequence} of
 * the records whose keys hash to the bucket (separate chaining). A second
 * {@code LinkedSequence} holds every key once, in insertion order. It is the
 * only source of iteration order; the buckets are never iterated as a whole.
 * <p>
 * The bucket index of a key is computed in two steps. The UTF-8 bytes of the
 * key are folded into a 32-bit integer with the djb2 string hash
 * ({@code h = 33 * h + b}, seeded with 5381). That integer is then mapped to
 * the table size with Knuth's multiplicative method, using the fractional part
 * of its product with {@code (sqrt(5) - 1) / 2}.
 * <p>
 * After an insert has added a record, the table doubles its number of buckets
 * as soon as the load factor {@code length() / capacity()} reaches
 * {@value #MAX_LOAD_FACTOR}. Growing rehashes all keys in key order. The table
 * never shrinks.
 * <p>
 * {@link #get(String)} and {@link #apply(String)} form a dual API: {@code get}
 * returns {@code null} for a missing key, {@code apply} throws a
 * {@link KeyNotFoundException}.
 *
 * @param <V> the value type
 */
public final class OrderedHashTable<V> implements Iterable<Tuple2<String, V>>, Serializable {
    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(OrderedHashTable.class);

    /**
     * The minimal number of buckets.
     */
    public static final int MIN_TABLE_SIZE = 64;
    /**
     * The factor by which the number of buckets grows.
     */
    public static final int GROWTH_RATE = 2;
    /**
     * The load factor at which the table grows.
     */
    public static final double MAX_LOAD_FACTOR = 0.5;

    private static final int HASH_SEED = 5381;
    private static final int HASH_MULTIPLIER = 33;
    private static final double HASH_CONSTANT = (2.23606797749978969 - 1) / 2;

    /**
     * The number of buckets.
     */
    private int size;
    private int recordCount;
    private LinkedSequence<Entry<V>>[] buckets;
    /**
     * In this sequence we store the keys in the order in which they were inserted.
     */
    private final LinkedSequence<String> keyList = new LinkedSequence<>();
    private final SequenceView<String> keyView = keyList.view();

    /**
     * Creates an empty table with {@value #MIN_TABLE_SIZE} buckets.
     */
    public OrderedHashTable() {
        this(MIN_TABLE_SIZE);
    }

    /**
     * Creates an empty table with the given number of buckets.
     *
     * @param capacity the number of buckets; values below {@value #MIN_TABLE_SIZE}
     *                 are raised to {@value #MIN_TABLE_SIZE}
     */
    public OrderedHashTable(int capacity) {
        this.size = Math.max(MIN_TABLE_SIZE, capacity);
        this.buckets = newBuckets(size);
    }

    /**
     * Creates a table with a single record.
     *
     * @param key   a key
     * @param value the value for the key
     * @param <V>   the value type
     * @return a new table
     */
    public static <V> OrderedHashTable<V> of(String key, V value) {
        OrderedHashTable<V> t = new OrderedHashTable<>();
        t.insert(key, value);
        return t;
    }

    /**
     * Creates a table of the given key-value pairs.
     *
     * @param k1  a key for the table
     * @param v1  the value for k1
     * @param k2  a key for the table
     * @param v2  the value for k2
     * @param <V> the value type
     * @return a new table
     */
    public static <V> OrderedHashTable<V> of(String k1, V v1, String k2, V v2) {
        OrderedHashTable<V> t = new OrderedHashTable<>();
        t.insert(k1, v1);
        t.insert(k2, v2);
        return t;
    }

    /**
     * Creates a table of the given key-value pairs.
     *
     * @param k1  a key for the table
     * @param v1  the value for k1
     * @param k2  a key for the table
     * @param v2  the value for k2
     * @param k3  a key for the table
     * @param v3  the value for k3
     * @param <V> the value type
     * @return a new table
     */
    public static <V> OrderedHashTable<V> of(String k1, V v1, String k2, V v2, String k3, V v3) {
        OrderedHashTable<V> t = new OrderedHashTable<>();
        t.insert(k1, v1);
        t.insert(k2, v2);
        t.insert(k3, v3);
        return t;
    }

    /**
     * Creates a table of the given entries, inserted in iteration order.
     *
     * @param entries key-value pairs
     * @param <V>     the value type
     * @return a new table
     * @throws NullPointerException if {@code entries} is null
     */
    public static <V> OrderedHashTable<V> ofEntries(Iterable<? extends Tuple2<String, ? extends V>> entries) {
        Objects.requireNonNull(entries, "entries is null");
        OrderedHashTable<V> t = new OrderedHashTable<>();
        for (Tuple2<String, ? extends V> entry : entries) {
            t.insert(entry._1, entry._2);
        }
        return t;
    }

    /**
     * Creates a table of the entries of a {@link java.util.Map}, inserted in the
     * iteration order of the map.
     *
     * @param map a map
     * @param <V> the value type
     * @return a new table
     * @throws NullPointerException if {@code map} is null
     */
    public static <V> OrderedHashTable<V> ofAll(Map<String, ? extends V> map) {
        Objects.requireNonNull(map, "map is null");
        OrderedHashTable<V> t = new OrderedHashTable<>();
        for (Map.Entry<String, ? extends V> entry : map.entrySet()) {
            t.insert(entry.getKey(), entry.getValue());
        }
        return t;
    }

    /**
     * Returns a {@link Collector} which may be used in conjunction with
     * {@link java.util.stream.Stream#collect(Collector)} to obtain an {@link OrderedHashTable}.
     *
     * @param keyMapper   the key mapper
     * @param valueMapper the value mapper
     * @param <V>         the value type
     * @param <T>         initial {@link java.util.stream.Stream} elements type
     * @return an {@link OrderedHashTable} Collector
     */
    public static <V, T> Collector<T, ArrayList<T>, OrderedHashTable<V>> collector(
            Function<? super T, ? extends String> keyMapper, Function<? super T, ? extends V> valueMapper) {
        Objects.requireNonNull(keyMapper, "keyMapper is null");
        Objects.requireNonNull(valueMapper, "valueMapper is null");
        return Collections.toListAndThen(arr -> {
            OrderedHashTable<V> t = new OrderedHashTable<>();
            for (T element : arr) {
                t.insert(keyMapper.apply(element), valueMapper.apply(element));
            }
            return t;
        });
    }

    @SuppressWarnings("unchecked")
    private static <V> LinkedSequence<Entry<V>>[] newBuckets(int size) {
        LinkedSequence<Entry<V>>[] buckets = (LinkedSequence<Entry<V>>[]) new LinkedSequence<?>[size];
        for (int i = 0; i < size; i++) {
            buckets[i] = new LinkedSequence<>();
        }
        return buckets;
    }

    // -- hashing

    int hash(String key) {
        return hash(key, size);
    }

    /**
     * Maps a key to a bucket index in {@code [0, tableSize)}.
     * <p>
     * {@code ceil(x) - 1} is {@code -1} if the fractional part is zero; that
     * case is mapped to bucket 0.
     */
    static int hash(String key, int tableSize) {
        int h = HASH_SEED;
        for (byte b : key.getBytes(StandardCharsets.UTF_8)) {
            h = HASH_MULTIPLIER * h + (b & 0xff);
        }
        double fraction = ((h & 0xffffffffL) * HASH_CONSTANT) % 1.0;
        int index = (int) Math.ceil(tableSize * fraction) - 1;
        return Math.max(0, index);
    }

    private void expand() {
        if (size > Integer.MAX_VALUE / GROWTH_RATE) {
            throw new IllegalStateException("OrderedHashTable cannot grow beyond " + size + " buckets");
        }
        int newSize = size * GROWTH_RATE;
        LinkedSequence<Entry<V>>[] newBuckets = newBuckets(newSize);
        for (String key : keyList) {
            Entry<V> entry = find(buckets[hash(key)], key);
            newBuckets[hash(key, newSize)].pushBack(new Entry<>(key, entry.value));
        }
        LOG.debug("Expanded OrderedHashTable from {} to {} buckets for {} records", size, newSize, recordCount);
        buckets = newBuckets;
        size = newSize;
    }

    private static <V> Entry<V> find(LinkedSequence<Entry<V>> bucket, String key) {
        for (Entry<V> entry : bucket) {
            if (entry.key.equals(key)) {
                return entry;
            }
        }
        return null;
    }

    private static <V> int indexOfKey(LinkedSequence<Entry<V>> bucket, String key) {
        int index = 0;
        for (Entry<V> entry : bucket) {
            if (entry.key.equals(key)) {
                return index;
            }
            index++;
        }
        return -1;
    }

    private Entry<V> entry(String key) {
        Objects.requireNonNull(key, "key is null");
        return find(buckets[hash(key)], key);
    }

    // -- updates

    /**
     * Associates the value with the key.
     * <p>
     * If the key is present, its value is replaced and its position in the key
     * order is kept. Otherwise the key is appended to the key order, and the
     * table grows if the load factor reaches {@value #MAX_LOAD_FACTOR}.
     *
     * @param key   a key
     * @param value a value
     * @throws NullPointerException if {@code key} is null
     */
    public void insert(String key, V value) {
        Objects.requireNonNull(key, "key is null");
        LinkedSequence<Entry<V>> bucket = buckets[hash(key)];
        Entry<V> entry = find(bucket, key);
        if (entry != null) {
            entry.value = value;
            return;
        }
        bucket.pushBack(new Entry<>(key, value));
        keyList.pushBack(key);
        recordCount++;
        if (recordCount / (double) size >= MAX_LOAD_FACTOR) {
            expand();
        }
    }

    /**
     * Removes the record with the given key.
     * <p>
     * Does nothing if the key is absent.
     *
     * @param key a key
     * @return true if a record was removed
     * @throws NullPointerException  if {@code key} is null
     * @throws IllegalStateException if the bucket and the key order disagree on the key
     */
    public boolean erase(String key) {
        Objects.requireNonNull(key, "key is null");
        LinkedSequence<Entry<V>> bucket = buckets[hash(key)];
        int bucketIndex = indexOfKey(bucket, key);
        if (bucketIndex >= 0) {
            bucket.erase(bucketIndex);
            recordCount--;
        }
        int orderIndex = keyList.indexOf(key);
        if (orderIndex >= 0) {
            keyList.erase(orderIndex);
        }
        if ((bucketIndex >= 0) != (orderIndex >= 0)) {
            throw new IllegalStateException("Bucket and key order disagree on key \"" + key + "\"");
        }
        return bucketIndex >= 0;
    }

    /**
     * Removes the most recently inserted record, and returns its value.
     *
     * @return the value of the removed record, or {@code null} if the table is empty
     * @throws IllegalStateException if the bucket and the key order disagree on the last key
     */
    public V pop() {
        if (recordCount == 0) {
            return null;
        }
        String key = keyList.popBack();
        Entry<V> entry = buckets[hash(key)].popBack();
        if (entry == null || !entry.key.equals(key)) {
            throw new IllegalStateException("Bucket and key order disagree on key \"" + key + "\"");
        }
        recordCount--;
        return entry.value;
    }

    /**
     * Replaces the value of a present key.
     *
     * @param key   a key
     * @param value the new value
     * @return the previous value
     * @throws KeyNotFoundException if the key is absent
     * @throws NullPointerException if {@code key} is null
     */
    public V set(String key, V value) {
        Entry<V> entry = entry(key);
        if (entry == null) {
            throw keyNotFound(key);
        }
        V old = entry.value;
        entry.value = value;
        return old;
    }

    // -- lookups

    /**
     * Returns the value for the key, or {@code null} if the key is absent.
     *
     * @param key a key
     * @return the value or null
     * @throws NullPointerException if {@code key} is null
     */
    public V get(String key) {
        Entry<V> entry = entry(key);
        return entry == null ? null : entry.value;
    }

    public V getOrElse(String key, V defaultValue) {
        Entry<V> entry = entry(key);
        return entry == null ? defaultValue : entry.value;
    }

    /**
     * Returns the value for the key as an {@link Option}.
     *
     * @param key a key
     * @return {@code Some(value)} if the key is present, {@code None} otherwise
     * @throws NullPointerException if {@code key} is null
     */
    public Option<V> getOption(String key) {
        Entry<V> entry = entry(key);
        return entry == null ? Option.none() : Option.some(entry.value);
    }

    /**
     * Returns the value for the key.
     *
     * @param key a key
     * @return the value
     * @throws KeyNotFoundException if the key is absent
     * @throws NullPointerException if {@code key} is null
     */
    public V apply(String key) {
        Entry<V> entry = entry(key);
        if (entry == null) {
            throw keyNotFound(key);
        }
        return entry.value;
    }

    private static KeyNotFoundException keyNotFound(String key) {
        KeyNotFoundException e = new KeyNotFoundException(key);
        LOG.debug(e.getMessage());
        return e;
    }

    public boolean containsKey(String key) {
        return entry(key) != null;
    }

    /**
     * Returns the keys in insertion order.
     * <p>
     * The returned view is backed by the table.
     *
     * @return a read-only view of the keys
     */
    public SequenceView<String> keys() {
        return keyView;
    }

    /**
     * Returns the values in the insertion order of their keys.
     *
     * @return a snapshot of the values
     */
    public Seq<V> values() {
        return iterator().map(Tuple2::_2).toList();
    }

    /**
     * Returns the number of records.
     *
     * @return the number of records
     */
    public int length() {
        return recordCount;
    }

    public boolean isEmpty() {
        return recordCount == 0;
    }

    /**
     * Returns the number of buckets.
     *
     * @return the number of buckets
     */
    public int capacity() {
        return size;
    }

    /**
     * Returns an iterator over the key-value pairs in insertion order.
     * <p>
     * The iterator fails fast if a key is inserted or removed while it is used.
     *
     * @return an iterator
     */
    @Override
    public Iterator<Tuple2<String, V>> iterator() {
        return keyList.iterator().map(key -> Tuple.of(key, get(key)));
    }

    public LinkedHashMap<String, V> toJavaMap() {
        LinkedHashMap<String, V> map = new LinkedHashMap<>();
        for (String key : keyList) {
            map.put(key, get(key));
        }
        return map;
    }

    // -- object methods

    @Override
    public boolean equals(Object o) {
        if (o == this) {
            return true;
        }
        if (!(o instanceof OrderedHashTable<?>)) {
            return false;
        }
        OrderedHashTable<?> that = (OrderedHashTable<?>) o;
        if (this.recordCount != that.recordCount) {
            return false;
        }
        java.util.Iterator<Tuple2<String, V>> a = this.iterator();
        java.util.Iterator<? extends Tuple2<String, ?>> b = that.iterator();
        while (a.hasNext()) {
            if (!a.next().equals(b.next())) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int hash = 1;
        for (Tuple2<String, V> entry : this) {
            hash = 31 * hash + entry.hashCode();
        }
        return hash;
    }

    @Override
    public String toString() {
        return iterator().map(t -> t._1 + " -> " + t._2).mkString("OrderedHashTable(", ", ", ")");
    }

    private Object writeReplace() throws ObjectStreamException {
        return new SerializationProxy<>(this);
    }

    private void readObject(ObjectInputStream s) throws InvalidObjectException {
        throw new InvalidObjectException("Proxy required");
    }

    private static final class Entry<V> {
        final String key;
        V value;

        Entry(String key, V value) {
            this.key = key;
            this.value = value;
        }
    }

    /**
     * A serialization proxy which, in this context, is used to deserialize mutable
     * tables without serializing their buckets.
     *
     * @param <V> The value type
     */
    // DEV NOTE: The serialization proxy pattern is not compatible with non-final, i.e. extendable,
    // classes. Also, it may not be compatible with circular object graphs.
    private static final class SerializationProxy<V> implements Serializable {

        private static final long serialVersionUID = 1L;

        // the instance to be serialized/deserialized
        private transient OrderedHashTable<V> table;

        /**
         * Constructor for the case of serialization, called by {@link OrderedHashTable#writeReplace()}.
         *
         * @param table a table
         */
        SerializationProxy(OrderedHashTable<V> table) {
            this.table = table;
        }

        /**
         * Read an object from a deserialization stream.
         *
         * @param s An object deserialization stream.
         * @throws ClassNotFoundException If the object's class read from the stream cannot be found.
         * @throws InvalidObjectException If the stream contains a negative number of records.
         * @throws IOException            If an error occurs reading from the stream.
         */
        @SuppressWarnings("unchecked")
        private void readObject(ObjectInputStream s) throws ClassNotFoundException, IOException {
            s.defaultReadObject();
            final int capacity = s.readInt();
            final int length = s.readInt();
            if (length < 0) {
                throw new InvalidObjectException("No records");
            }
            OrderedHashTable<V> t = new OrderedHashTable<>(capacity);
            for (int i = 0; i < length; i++) {
                final String key = (String) s.readObject();
                final V value = (V) s.readObject();
                t.insert(key, value);
            }
            table = t;
        }

        /**
         * {@code readResolve} method for the serialization proxy pattern.
         *
         * @return A deserialized instance of the enclosing class.
         */
        private Object readResolve() {
            return table;
        }

        /**
         * Write an object to a serialization stream.
         *
         * @param s An object serialization stream.
         * @throws IOException If an error occurs writing to the stream.
         */
        private void writeObject(ObjectOutputStream s) throws IOException {
            s.defaultWriteObject();
            s.writeInt(table.capacity());
            s.writeInt(table.length());
            for (Tuple2<String, V> e : table) {
                s.writeObject(e._1);
                s.writeObject(e._2);
            }
        }
    }
}
