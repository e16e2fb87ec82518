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

package io.github.flanglet.ordo.util.sort;

import io.github.flanglet.ordo.BufferAllocator;
import io.github.flanglet.ordo.ElementComparator;
import io.github.flanglet.ordo.Sequence;
import io.github.flanglet.ordo.SortException;
import io.github.flanglet.ordo.Sorter;

/**
 * The {@code MergeSort} class implements a stable, bottom-up merge sort.
 *
 * <p>The span is cut into blocks of {@code threshold} elements which are sorted
 * with {@link InsertionSort}. Adjacent runs are then merged pairwise through a
 * temporary buffer and copied back, doubling the run width at each pass until a
 * single run covers the span. When two elements are equal the one from the left
 * run is written first, so equal elements keep their input order.</p>
 *
 * <p>One buffer, as long as the span, is obtained from the {@link BufferAllocator}
 * for each call to {@link #sort} and handed back to it before the call returns,
 * even if the comparator throws. Failure to obtain the buffer is reported as a
 * {@link SortException} with code {@link SortException#RESOURCE_EXHAUSTED},
 * before any element has moved.</p>
 *
 * @param <E> the element type
 */
public class MergeSort<E> implements Sorter<E> {

   // Default length of the blocks sorted by insertion sort
   private static final int DEFAULT_BLOCK_SIZE = 32;

   private final ElementComparator<? super E> cmp;
   private final int blockSize;
   private final BufferAllocator allocator;

   /**
    * Constructs a new {@code MergeSort} instance with blocks of 32 elements
    * and buffers allocated on the heap.
    *
    * @param cmp the element ordering
    */
   public MergeSort(ElementComparator<? super E> cmp) {
      this(cmp, DEFAULT_BLOCK_SIZE, BufferAllocator.HEAP);
   }

   /**
    * Constructs a new {@code MergeSort} instance.
    *
    * @param cmp the element ordering
    * @param blockSize the length of the blocks pre-sorted by insertion sort, must be positive
    * @param allocator the provider of the temporary buffer
    * @throws NullPointerException if {@code cmp} or {@code allocator} is {@code null}
    * @throws IllegalArgumentException if {@code blockSize} is not positive
    */
   public MergeSort(ElementComparator<? super E> cmp, int blockSize, BufferAllocator allocator) {
      if (cmp == null)
         throw new NullPointerException("Invalid null comparator parameter");

      if (allocator == null)
         throw new NullPointerException("Invalid null allocator parameter");

      if (blockSize < 1)
         throw new IllegalArgumentException("Invalid block size (must be positive): " + blockSize);

      this.cmp = cmp;
      this.blockSize = blockSize;
      this.allocator = allocator;
   }

   /**
    * Sorts the specified portion of the input sequence, keeping equal elements
    * in their input order.
    *
    * @param input the sequence to be sorted.
    * @param blkptr the starting index of the portion to be sorted.
    * @param len the number of elements to sort.
    * @return {@code true} if the sorting was successful, {@code false} if invalid parameters were provided (out-of-bounds indices).
    * @throws SortException if the temporary buffer cannot be obtained
    */
   @Override
   public boolean sort(Sequence<E> input, int blkptr, int len) {
      if ((input == null) || (blkptr < 0) || (len < 0))
         return false;

      if (blkptr > input.length() - len)
         return false;

      if (len < 2)
         return true;

      final Object[] buffer = this.acquire(len);

      try {
         this.mergeSort(input, blkptr, blkptr + len, buffer);
      } finally {
         this.allocator.release(buffer);
      }

      return true;
   }

   private Object[] acquire(int len) {
      final Object[] buffer;

      try {
         buffer = this.allocator.allocate(len);
      } catch (OutOfMemoryError e) {
         throw new SortException("Cannot allocate a merge buffer of " + len + " elements", e,
            SortException.RESOURCE_EXHAUSTED);
      }

      if (buffer == null)
         throw new SortException("The allocator returned no buffer for " + len + " elements",
            SortException.RESOURCE_EXHAUSTED);

      if (buffer.length < len) {
         this.allocator.release(buffer);
         throw new SortException("The allocator returned a buffer of " + buffer.length
            + " elements, " + len + " required", SortException.RESOURCE_EXHAUSTED);
      }

      return buffer;
   }

   private void mergeSort(Sequence<E> s, int low, int high, Object[] buffer) {
      final int count = high - low;
      final int block = this.blockSize;

      for (int i = low; i < high; i += block)
         InsertionSort.sortSpan(s, i, (high - i > block) ? i + block : high, this.cmp);

      int width = block;

      while (width < count) {
         // Merge [i, i+width) with [i+width, i+2*width) while a right run exists
         for (int i = low; high - i > width; i += (width << 1)) {
            final int mid = i + width;
            final int end = (high - mid > width) ? mid + width : high;
            this.merge(s, i, mid, end, buffer);

            if (high - end <= width)
               break;
         }

         // 2*width >= count: the pass above produced a single run
         if (width >= count - width)
            break;

         width <<= 1;
      }
   }

   /**
    * Merges the sorted runs {@code [low, mid)} and {@code [mid, high)}.
    */
   @SuppressWarnings("unchecked")
   private void merge(Sequence<E> s, int low, int mid, int high, Object[] buffer) {
      // Already in order
      if (this.cmp.precedes(s.get(mid), s.get(mid - 1)) == false)
         return;

      int i = low;
      int j = mid;
      int k = 0;

      while ((i < mid) && (j < high)) {
         // Take from the right run only when strictly smaller
         if (this.cmp.precedes(s.get(j), s.get(i)))
            buffer[k++] = s.get(j++);
         else
            buffer[k++] = s.get(i++);
      }

      while (i < mid)
         buffer[k++] = s.get(i++);

      // What remains of the right run is already in place
      for (int n = 0; n < k; n++) {
         s.set(low + n, (E) buffer[n]);
         buffer[n] = null;
      }
   }
}
