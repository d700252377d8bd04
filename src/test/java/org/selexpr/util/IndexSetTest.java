/*
 * Copyright 2025 The Selexpr Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.selexpr.util;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import java.util.Random;
import java.util.TreeSet;
import junitparams.JUnitParamsRunner;
import junitparams.Parameters;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(JUnitParamsRunner.class)
public class IndexSetTest {

  @Test
  public void ofSortsAndRemovesDuplicates() {
    IndexSet set = IndexSet.of(5, 1, 3, 1, 5);
    assertThat(set.toArray()).asList().containsExactly(1, 3, 5).inOrder();
    assertThat(set.size()).isEqualTo(3);
    assertThat(set.indexOf(3)).isEqualTo(1);
    assertThat(set.indexOf(4)).isLessThan(0);
  }

  @Test
  public void negativeIndicesAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> IndexSet.of(2, -1));
  }

  @Test
  public void forRange() {
    assertThat(IndexSet.forRange(3, 2)).isSameInstanceAs(IndexSet.EMPTY);
    assertThat(IndexSet.forRange(2, 4)).isEqualTo(IndexSet.of(2, 3, 4));
  }

  @Test
  public void toStringShowsRuns() {
    assertThat(IndexSet.EMPTY.toString()).isEqualTo("{}");
    assertThat(IndexSet.of(0, 1, 2, 3, 7, 9, 10).toString()).isEqualTo("{0..3, 7, 9..10}");
  }

  @Test
  public void subset() {
    assertThat(IndexSet.of(1, 3).isSubsetOf(IndexSet.forRange(0, 5))).isTrue();
    assertThat(IndexSet.of(1, 6).isSubsetOf(IndexSet.forRange(0, 5))).isFalse();
    assertThat(IndexSet.EMPTY.isSubsetOf(IndexSet.EMPTY)).isTrue();
  }

  @Test
  public void operationsReturnArgumentWhenUnchanged() {
    IndexSet a = IndexSet.of(1, 2, 3);
    IndexSet b = IndexSet.of(2);
    assertThat(a.union(b)).isSameInstanceAs(a);
    assertThat(b.intersection(a)).isSameInstanceAs(b);
    assertThat(a.difference(IndexSet.EMPTY)).isSameInstanceAs(a);
  }

  @Test
  public void mergeDisjoint() {
    assertThat(IndexSet.of(1, 5).mergeDisjoint(IndexSet.of(0, 3, 9)))
        .isEqualTo(IndexSet.of(0, 1, 3, 5, 9));
    assertThrows(
        IllegalArgumentException.class, () -> IndexSet.of(1, 2).mergeDisjoint(IndexSet.of(2)));
  }

  @Test
  public void partition() {
    IndexSet[] parts = IndexSet.forRange(0, 9).partition(IndexSet.of(2, 4, 12));
    assertThat(parts[0]).isEqualTo(IndexSet.of(2, 4));
    assertThat(parts[1]).isEqualTo(IndexSet.of(0, 1, 3, 5, 6, 7, 8, 9));
  }

  private static Object[] seeds() {
    return new Object[] {1, 17, 42, 1234};
  }

  /** Checks each operation against a TreeSet over random inputs. */
  @Test
  @Parameters(method = "seeds")
  public void operationsMatchTreeSet(int seed) {
    Random random = new Random(seed);
    for (int iteration = 0; iteration < 50; iteration++) {
      TreeSet<Integer> left = randomSet(random);
      TreeSet<Integer> right = randomSet(random);
      IndexSet a = toIndexSet(left);
      IndexSet b = toIndexSet(right);

      TreeSet<Integer> expected = new TreeSet<>(left);
      expected.addAll(right);
      assertThat(a.union(b)).isEqualTo(toIndexSet(expected));

      expected = new TreeSet<>(left);
      expected.retainAll(right);
      assertThat(a.intersection(b)).isEqualTo(toIndexSet(expected));

      expected = new TreeSet<>(left);
      expected.removeAll(right);
      assertThat(a.difference(b)).isEqualTo(toIndexSet(expected));
    }
  }

  private static TreeSet<Integer> randomSet(Random random) {
    TreeSet<Integer> result = new TreeSet<>();
    int n = random.nextInt(20);
    for (int i = 0; i < n; i++) {
      result.add(random.nextInt(40));
    }
    return result;
  }

  private static IndexSet toIndexSet(TreeSet<Integer> set) {
    IndexSet.Builder builder = new IndexSet.Builder();
    set.forEach(builder::add);
    return builder.build();
  }
}
