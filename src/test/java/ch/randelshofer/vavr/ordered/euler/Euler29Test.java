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
package ch.randelshofer.vavr.ordered.euler;

import ch.randelshofer.vavr.ordered.LinkedSequence;
import ch.randelshofer.vavr.ordered.OrderedHashTable;
import io.vavr.collection.List;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Comparator;

import static org.assertj.core.api.Assertions.assertThat;

public class Euler29Test {

    private static OrderedHashTable<Integer> distinctPowers(int limit) {
        OrderedHashTable<Integer> terms = new OrderedHashTable<>();
        for (int a = 2; a <= limit; a++) {
            for (int b = 2; b <= limit; b++) {
                String term = BigInteger.valueOf(a).pow(b).toString();
                terms.insert(term, terms.getOrElse(term, 0) + 1);
            }
        }
        return terms;
    }

    /**
     * <strong>Problem 29 Distinct powers</strong>
     * <p>
     * Consider all integer combinations of <i>a<sup>b</sup></i> for 2 ≤ <i>a</i> ≤ 5
     * and 2 ≤ <i>b</i> ≤ 5. If they are placed in numerical order, with any
     * repeats removed, we get a sequence of 15 distinct terms.
     * <p>
     * How many distinct terms are in the sequence generated by <i>a<sup>b</sup></i>
     * for 2 ≤ <i>a</i> ≤ 100 and 2 ≤ <i>b</i> ≤ 100?
     * <p>
     * See also <a href="https://projecteuler.net/problem=29">projecteuler.net
     * problem 29</a>.
     */
    @Test
    public void shouldSolveProblem29() {
        OrderedHashTable<Integer> small = distinctPowers(5);
        assertThat(small.length()).isEqualTo(15);
        assertThat(small.apply("16")).isEqualTo(2);

        LinkedSequence<BigInteger> sorted = small.keys().stream()
                .map(BigInteger::new)
                .collect(LinkedSequence.collector());
        sorted.sort();
        assertThat(sorted.toList().map(BigInteger::intValue))
                .isEqualTo(List.of(4, 8, 9, 16, 25, 27, 32, 64, 81, 125, 243, 256, 625, 1024, 3125));

        OrderedHashTable<Integer> large = distinctPowers(100);
        assertThat(large.length()).isEqualTo(9183);
        assertThat(large.keys().length()).isEqualTo(9183);
        assertThat(large.capacity()).isEqualTo(32768);
    }

    @Test
    public void shouldOrderTermsByNumberOfRepresentations() {
        LinkedSequence<String> terms = LinkedSequence.ofAll(distinctPowers(10).keys());
        OrderedHashTable<Integer> counts = distinctPowers(10);
        terms.sort(Comparator.comparing(counts::apply, Comparator.reverseOrder()));
        // 64 = 2^6 = 4^3 = 8^2 is the only term with three representations
        assertThat(counts.apply(terms.peekFirst())).isEqualTo(3);
        assertThat(counts.apply(terms.peekLast())).isEqualTo(1);
    }
}
