package io.github.coderodde.heap;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * This class provides methods for sorting arrays and collections with
 * heapsort. The input is first arranged into a binary max-heap, after which
 * the maximum is repeatedly swapped to the end of a shrinking active region.
 * The sort runs in {@code O(n log n)} time and {@code O(1)} extra space for
 * primitive arrays. It is not stable.
 */
public final class HeapSort {

    private HeapSort() {

    }

    /**
     * Sorts the entire {@code int} array into ascending order in place.
     *
     * @param array the array to sort.
     */
    public static void sort(int[] array) {
        Objects.requireNonNull(array, "The input array is null.");
        sort(array, 0, array.length);
    }

    /**
     * Sorts the range {@code array[fromIndex], ..., array[toIndex - 1]} into
     * ascending order in place.
     *
     * @param array     the array holding the range to sort.
     * @param fromIndex the starting, inclusive index.
     * @param toIndex   the ending, exclusive index.
     */
    public static void sort(int[] array, int fromIndex, int toIndex) {
        Objects.requireNonNull(array, "The input array is null.");
        checkRange(array.length, fromIndex, toIndex);

        int n = toIndex - fromIndex;

        if (n <= 1) {
            return;
        }

        for (int i = (n >>> 1) - 1; i >= 0; --i) {
            siftDown(array, fromIndex, i, n);
        }

        for (int boundary = n - 1; boundary > 0; --boundary) {
            int tmp = array[fromIndex];
            array[fromIndex] = array[fromIndex + boundary];
            array[fromIndex + boundary] = tmp;
            siftDown(array, fromIndex, 0, boundary);
        }
    }

    /**
     * Sorts the array of comparable objects into ascending order in place. If
     * any two elements cannot be compared, the input array is left as it was.
     * Arrays of at most one element are never compared, so they may hold a
     * {@code null}.
     *
     * @param <T>   the element type.
     * @param array the array to sort.
     * @throws ComparisonException if an element is {@code null} or two
     *                             elements are mutually incomparable.
     */
    public static <T extends Comparable<? super T>> void sort(T[] array) {
        Objects.requireNonNull(array, "The input array is null.");

        if (array.length <= 1) {
            return;
        }

        T[] work = array.clone();
        heapSort(work);
        System.arraycopy(work, 0, array, 0, work.length);
    }

    /**
     * Returns a new list holding the elements of {@code collection} in
     * ascending order. The input collection is not modified.
     *
     * @param <T>        the element type.
     * @param collection the elements to sort.
     * @return a new sorted list.
     * @throws ComparisonException if an element is {@code null} or two
     *                             elements are mutually incomparable.
     */
    public static <T extends Comparable<? super T>> List<T>
            sorted(Collection<T> collection) {

        Objects.requireNonNull(collection, "The input collection is null.");

        @SuppressWarnings("unchecked")
        T[] work = (T[]) collection.toArray(new Comparable[collection.size()]);

        heapSort(work);

        List<T> result = new ArrayList<>(work.length);

        for (T element : work) {
            result.add(element);
        }

        return result;
    }

    private static <T extends Comparable<? super T>> void heapSort(T[] array) {
        int n = array.length;

        if (n <= 1) {
            return;
        }

        for (int i = (n >>> 1) - 1; i >= 0; --i) {
            siftDown(array, i, n);
        }

        for (int boundary = n - 1; boundary > 0; --boundary) {
            T tmp = array[0];
            array[0] = array[boundary];
            array[boundary] = tmp;
            siftDown(array, 0, boundary);
        }
    }

    // Both siftDown variants swap only on a strictly greater child, so equal
    // keys stay put.
    private static void siftDown(int[] array, int offset, int i, int bound) {
        while (true) {
            int left = (i << 1) + 1;

            if (left >= bound) {
                return;
            }

            int right = left + 1;
            int largest = left;

            if (right < bound
                    && array[offset + right] > array[offset + left]) {
                largest = right;
            }

            if (array[offset + largest] <= array[offset + i]) {
                return;
            }

            int tmp = array[offset + i];
            array[offset + i] = array[offset + largest];
            array[offset + largest] = tmp;
            i = largest;
        }
    }

    private static <T extends Comparable<? super T>> void siftDown(T[] array,
                                                                   int i,
                                                                   int bound) {
        while (true) {
            int left = (i << 1) + 1;

            if (left >= bound) {
                return;
            }

            int right = left + 1;
            int largest = left;

            if (right < bound && compare(array, right, left) > 0) {
                largest = right;
            }

            if (compare(array, largest, i) <= 0) {
                return;
            }

            T tmp = array[i];
            array[i] = array[largest];
            array[largest] = tmp;
            i = largest;
        }
    }

    private static <T extends Comparable<? super T>> int compare(T[] array,
                                                                 int i,
                                                                 int j) {
        T a = requireNonNullElement(array[i], i);
        T b = requireNonNullElement(array[j], j);

        try {
            return a.compareTo(b);
        } catch (ClassCastException ex) {
            throw new ComparisonException(
                    "Cannot compare " + a + " with " + b + ": "
                            + ex.getMessage(),
                    ex);
        }
    }

    private static <T> T requireNonNullElement(T element, int index) {
        if (element == null) {
            throw new ComparisonException(
                    "Cannot compare the null element at heap index " + index);
        }

        return element;
    }

    private static void checkRange(int length, int fromIndex, int toIndex) {
        if (fromIndex > toIndex) {
            throw new IllegalArgumentException(
                    "fromIndex(" + fromIndex + ") > toIndex(" + toIndex + ")");
        }

        if (fromIndex < 0) {
            throw new ArrayIndexOutOfBoundsException(fromIndex);
        }

        if (toIndex > length) {
            throw new ArrayIndexOutOfBoundsException(toIndex);
        }
    }
}
