/*
Copyright 2011-2025 Frederic Langlet
Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
you may obtain a copy of the License at

                http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/

package io.github.flanglet.ordo;

import io.github.flanglet.ordo.util.sort.InsertionSort;
import io.github.flanglet.ordo.util.sort.MergeSort;
import io.github.flanglet.ordo.util.sort.QuickSelect;
import io.github.flanglet.ordo.util.sort.QuickSort;
import io.github.flanglet.ordo.util.sort.SmallNetworkSort;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Public entry point of the sorting engine. It validates the arguments, picks
 * an algorithm from the span length and the stability request, and notifies
 * the registered listeners before and after each operation.
 *
 * <p>Dispatch rule for a span of {@code n} elements:</p>
 * <ul>
 *   <li>{@code n <= 1}: nothing to do,</li>
 *   <li>{@code n <= 5}: {@link SmallNetworkSort}, or {@link InsertionSort} if a stable sort is requested
 *       (the networks are not stable),</li>
 *   <li>{@code n < threshold}: {@link InsertionSort},</li>
 *   <li>otherwise: {@link MergeSort} if a stable sort is requested, {@link QuickSort} if not.</li>
 * </ul>
 *
 * <p>The dispatcher is configured with a context map:</p>
 * <ul>
 *   <li>{@code "threshold"} (Integer): insertion sort threshold, in [{@value #MIN_THRESHOLD},
 *       {@value #MAX_THRESHOLD}], default {@value #DEFAULT_THRESHOLD},</li>
 *   <li>{@code "worstCaseGuard"} (Boolean): bound quicksort to O(n log n) with a heap sort fallback,
 *       default {@code false},</li>
 *   <li>{@code "allocator"} ({@link BufferAllocator}): provider of the merge sort buffer,
 *       default {@link BufferAllocator#HEAP}.</li>
 * </ul>
 *
 * <p>No operation uses randomness: the same input, ordering and flags always
 * produce the same output.</p>
 */
public class SortDispatcher {

   /** Default insertion sort threshold. */
   public static final int DEFAULT_THRESHOLD = QuickSort.DEFAULT_INSERTION_SORT_THRESHOLD;

   /** Smallest accepted insertion sort threshold. */
   public static final int MIN_THRESHOLD = SmallNetworkSort.MAX_LENGTH + 1;

   /** Largest accepted insertion sort threshold. */
   public static final int MAX_THRESHOLD = 1024;

   private final int threshold;
   private final boolean worstCaseGuard;
   private final BufferAllocator allocator;
   private final List<Listener> listeners;
   private final AtomicInteger operationId;


   /**
    * Creates a dispatcher with the default configuration.
    */
   public SortDispatcher() {
      this(Collections.<String, Object>emptyMap());
   }


   /**
    * Creates a dispatcher configured by a context map.
    *
    * @param ctx the configuration, see the class documentation for the keys
    * @throws NullPointerException if {@code ctx} is {@code null}
    * @throws IllegalArgumentException if a value has the wrong type or is out of range
    */
   public SortDispatcher(Map<String, Object> ctx) {
      if (ctx == null)
         throw new NullPointerException("Invalid null context parameter");

      Object val = ctx.get("threshold");
      int t = DEFAULT_THRESHOLD;

      if (val != null) {
         if ((val instanceof Integer) == false)
            throw new IllegalArgumentException("Invalid threshold type: " + val.getClass().getName());

         t = (Integer) val;

         if ((t < MIN_THRESHOLD) || (t > MAX_THRESHOLD))
            throw new IllegalArgumentException("Invalid threshold (must be in [" + MIN_THRESHOLD + ".."
               + MAX_THRESHOLD + "], got " + t + ")");
      }

      val = ctx.get("worstCaseGuard");

      if ((val != null) && ((val instanceof Boolean) == false))
         throw new IllegalArgumentException("Invalid worstCaseGuard type: " + val.getClass().getName());

      val = ctx.get("allocator");

      if ((val != null) && ((val instanceof BufferAllocator) == false))
         throw new IllegalArgumentException("Invalid allocator type: " + val.getClass().getName());

      this.threshold = t;
      this.worstCaseGuard = Boolean.TRUE.equals(ctx.get("worstCaseGuard"));
      this.allocator = (val == null) ? BufferAllocator.HEAP : (BufferAllocator) val;
      this.listeners = new ArrayList<>(4);
      this.operationId = new AtomicInteger(0);
   }


   /**
    * Registers a listener notified at the start and end of each operation.
    *
    * @param bl The listener to be added.
    * @return {@code true} if the listener was added successfully, {@code false} otherwise.
    */
   public boolean addListener(Listener bl) {
      return (bl != null) ? this.listeners.add(bl) : false;
   }


   /**
    * Removes a previously registered listener.
    *
    * @param bl The listener to be removed.
    * @return {@code true} if the listener was removed successfully, {@code false} otherwise.
    */
   public boolean removeListener(Listener bl) {
      return (bl != null) ? this.listeners.remove(bl) : false;
   }


   /**
    * Returns the insertion sort threshold.
    *
    * @return the length under which spans are insertion sorted
    */
   public int getThreshold() {
      return this.threshold;
   }


   /**
    * Tells whether quicksort falls back to heap sort on deep partitions.
    *
    * @return {@code true} if the worst case guard is enabled
    */
   public boolean isWorstCaseGuard() {
      return this.worstCaseGuard;
   }


   /**
    * Returns the algorithm used to sort {@code length} elements.
    *
    * @param length the number of elements
    * @param stable {@code true} if equal elements must keep their input order
    * @return the strategy chosen by the dispatch rule
    */
   public Event.Strategy selectStrategy(int length, boolean stable) {
      if (length <= 1)
         return Event.Strategy.NONE;

      if (length <= SmallNetworkSort.MAX_LENGTH)
         return (stable == true) ? Event.Strategy.INSERTION : Event.Strategy.NETWORK;

      if (length < this.threshold)
         return Event.Strategy.INSERTION;

      return (stable == true) ? Event.Strategy.MERGE : Event.Strategy.QUICK;
   }


   /**
    * Sorts the whole sequence. The sort is not stable.
    *
    * @param <E> the element type
    * @param seq the sequence to sort in place
    * @param cmp the element ordering
    */
   public <E> void sort(Sequence<E> seq, ElementComparator<? super E> cmp) {
      this.sort(seq, cmp, false);
   }


   /**
    * Sorts the whole sequence.
    *
    * @param <E> the element type
    * @param seq the sequence to sort in place
    * @param cmp the element ordering
    * @param stable {@code true} if equal elements must keep their input order
    * @throws SortException if a stable sort cannot obtain its buffer
    */
   public <E> void sort(Sequence<E> seq, ElementComparator<? super E> cmp, boolean stable) {
      checkNotNull(seq, cmp);
      this.sort(seq, 0, seq.length(), cmp, stable);
   }


   /**
    * Sorts the elements of the sequence in {@code [from, to)}.
    *
    * @param <E> the element type
    * @param seq the sequence to sort in place
    * @param from the first index to sort
    * @param to the index past the last element to sort
    * @param cmp the element ordering
    * @param stable {@code true} if equal elements must keep their input order
    * @throws SortException if the range is invalid or if a stable sort cannot obtain its buffer
    */
   public <E> void sort(Sequence<E> seq, int from, int to, ElementComparator<? super E> cmp, boolean stable) {
      checkNotNull(seq, cmp);

      if ((from < 0) || (to < from) || (to > seq.length()))
         throw new SortException("Invalid range [" + from + ", " + to + ") for a sequence of "
            + seq.length() + " elements", SortException.INVALID_ARGUMENT);

      final int length = to - from;
      final Event.Strategy strategy = this.selectStrategy(length, stable);
      final int id = this.operationId.incrementAndGet();
      this.notifyListeners(new Event(Event.Type.SORT_START, id, length, strategy));
      final Sorter<E> sorter;

      switch (strategy) {
         case NETWORK:
            sorter = new SmallNetworkSort<>(cmp);
            break;

         case INSERTION:
            sorter = new InsertionSort<>(cmp);
            break;

         case MERGE:
            sorter = new MergeSort<>(cmp, this.threshold, this.allocator);
            break;

         case QUICK:
            sorter = new QuickSort<>(cmp, this.threshold, this.worstCaseGuard);
            break;

         default:
            sorter = null;
      }

      if (sorter != null)
         sorter.sort(seq, from, length);

      this.notifyListeners(new Event(Event.Type.SORT_END, id, length, strategy));
   }


   /**
    * Rearranges the sequence so that index {@code k} holds the element a full
    * sort would put there, with no element after it in {@code [0, k)} and no
    * element before it in {@code (k, length)}.
    *
    * @param <E> the element type
    * @param seq the sequence to rearrange in place
    * @param k the rank to settle, in {@code [0, length)}
    * @param cmp the element ordering
    * @throws SortException if {@code k} is outside of {@code [0, length)}
    */
   public <E> void partitionByRank(Sequence<E> seq, int k, ElementComparator<? super E> cmp) {
      checkNotNull(seq, cmp);
      final int length = seq.length();

      if ((k < 0) || (k >= length))
         throw new SortException("Invalid rank " + k + " for a sequence of " + length + " elements",
            SortException.INVALID_ARGUMENT);

      final int id = this.operationId.incrementAndGet();
      this.notifyListeners(new Event(Event.Type.SELECT_START, id, length, Event.Strategy.SELECT));
      new QuickSelect<E>(cmp).select(seq, 0, length, k);
      this.notifyListeners(new Event(Event.Type.SELECT_END, id, length, Event.Strategy.SELECT));
   }


   /**
    * Sorts the whole sequence with insertion sort, whatever its length. Meant
    * for inputs known to be short or nearly sorted. The sort is stable.
    *
    * @param <E> the element type
    * @param seq the sequence to sort in place
    * @param cmp the element ordering
    */
   public <E> void insertionSort(Sequence<E> seq, ElementComparator<? super E> cmp) {
      checkNotNull(seq, cmp);
      final int length = seq.length();
      final int id = this.operationId.incrementAndGet();
      this.notifyListeners(new Event(Event.Type.SORT_START, id, length, Event.Strategy.INSERTION));
      new InsertionSort<E>(cmp).sort(seq, 0, length);
      this.notifyListeners(new Event(Event.Type.SORT_END, id, length, Event.Strategy.INSERTION));
   }


   private void notifyListeners(Event evt) {
      for (Listener bl : this.listeners)
         bl.processEvent(evt);
   }


   private static void checkNotNull(Sequence<?> seq, ElementComparator<?> cmp) {
      if (seq == null)
         throw new NullPointerException("Invalid null sequence parameter");

      if (cmp == null)
         throw new NullPointerException("Invalid null comparator parameter");
   }
}
