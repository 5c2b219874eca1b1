package io.github.coderodde.heap;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This class implements an array-based binary max-heap of {@link Task}s that
 * keeps a position map from task IDs to array indices. The map makes it
 * possible to change the priority of or remove any queued task in
 * logarithmic time without scanning the array.
 *
 * <p>Tasks with higher priority come out first. Ties are broken by earlier
 * arrival time, and then by the lexicographically smaller task ID.
 *
 * <p>This class is not thread-safe.
 */
public final class IndexedPriorityQueue {

    private static final Logger LOGGER =
            LoggerFactory.getLogger(IndexedPriorityQueue.class);

    private static final int DEFAULT_CAPACITY = 16;

    private Task[] heap = new Task[DEFAULT_CAPACITY];
    private final Map<String, Integer> positions = new HashMap<>();
    private int size;

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public boolean contains(String taskId) {
        return positions.containsKey(taskId);
    }

    /**
     * Returns the current priority of the task with the given ID.
     *
     * @param taskId the task ID.
     * @return the priority of the task.
     * @throws UnknownIdException if the task is not queued.
     */
    public int priorityOf(String taskId) {
        return heap[indexOf(taskId)].getPriority();
    }

    /**
     * Adds a task to this queue.
     *
     * @param task the task to add.
     * @throws DuplicateIdException    if a task with the same ID is queued.
     * @throws IllegalArgumentException if the task is held by another queue.
     */
    public void insert(Task task) {
        Objects.requireNonNull(task, "The task is null.");

        if (positions.containsKey(task.getTaskId())) {
            throw new DuplicateIdException(task.getTaskId());
        }

        if (task.getOwner() != null) {
            throw new IllegalArgumentException(
                    "Task with id="
                            + task.getTaskId()
                            + " is already held by another queue.");
        }

        ensureCapacity();
        task.setOwner(this);
        heap[size] = task;
        positions.put(task.getTaskId(), size);
        siftUp(size++);

        assert checkInvariants();
    }

    /**
     * Returns the highest priority task without removing it.
     *
     * @return the highest priority task.
     * @throws EmptyQueueException if this queue is empty.
     */
    public Task peekMax() {
        if (isEmpty()) {
            throw new EmptyQueueException("peekMax from empty priority queue");
        }

        return heap[0];
    }

    /**
     * Removes and returns the highest priority task.
     *
     * @return the highest priority task.
     * @throws EmptyQueueException if this queue is empty.
     */
    public Task extractMax() {
        if (isEmpty()) {
            throw new EmptyQueueException(
                    "extractMax from empty priority queue");
        }

        Task top = heap[0];
        Task last = heap[--size];
        heap[size] = null;
        positions.remove(top.getTaskId());
        top.setOwner(null);

        if (size > 0) {
            heap[0] = last;
            positions.put(last.getTaskId(), 0);
            siftDown(0);
        }

        assert checkInvariants();
        return top;
    }

    /**
     * Raises the priority of a queued task.
     *
     * @param taskId      the ID of the task.
     * @param newPriority the new priority. Must not be lower than the current
     *                    one.
     * @throws UnknownIdException        if the task is not queued.
     * @throws InvalidKeyChangeException if {@code newPriority} is lower than
     *                                   the current priority.
     */
    public void increaseKey(String taskId, int newPriority) {
        int index = indexOf(taskId);
        Task task = heap[index];

        if (newPriority < task.getPriority()) {
            throw new InvalidKeyChangeException(
                    "increaseKey requires new priority >= current priority: "
                            + newPriority
                            + " < "
                            + task.getPriority());
        }

        LOGGER.trace("Increasing priority of {} from {} to {}.",
                     taskId,
                     task.getPriority(),
                     newPriority);

        task.setPriority(newPriority);
        siftUp(index);

        assert checkInvariants();
    }

    /**
     * Lowers the priority of a queued task.
     *
     * @param taskId      the ID of the task.
     * @param newPriority the new priority. Must not be higher than the current
     *                    one.
     * @throws UnknownIdException        if the task is not queued.
     * @throws InvalidKeyChangeException if {@code newPriority} is higher than
     *                                   the current priority.
     */
    public void decreaseKey(String taskId, int newPriority) {
        int index = indexOf(taskId);
        Task task = heap[index];

        if (newPriority > task.getPriority()) {
            throw new InvalidKeyChangeException(
                    "decreaseKey requires new priority <= current priority: "
                            + newPriority
                            + " > "
                            + task.getPriority());
        }

        LOGGER.trace("Decreasing priority of {} from {} to {}.",
                     taskId,
                     task.getPriority(),
                     newPriority);

        task.setPriority(newPriority);
        siftDown(index);

        assert checkInvariants();
    }

    /**
     * Removes the task with the given ID regardless of its position.
     *
     * @param taskId the ID of the task to remove.
     * @return the removed task.
     * @throws UnknownIdException if the task is not queued.
     */
    public Task remove(String taskId) {
        int index = indexOf(taskId);
        int last = size - 1;

        swap(index, last);

        Task removed = heap[last];
        heap[last] = null;
        positions.remove(taskId);
        removed.setOwner(null);
        size = last;

        if (index < size) {
            // The element moved in from the tail may belong above or below.
            Task moved = heap[index];
            siftDown(index);

            if (heap[index] == moved) {
                siftUp(index);
            }
        }

        LOGGER.trace("Removed {}.", removed);

        assert checkInvariants();
        return removed;
    }

    /**
     * Extracts all the tasks in priority order, leaving this queue empty.
     *
     * @return the list of tasks in extraction order.
     */
    public List<Task> drain() {
        List<Task> tasks = new ArrayList<>(size);

        while (!isEmpty()) {
            tasks.add(extractMax());
        }

        return tasks;
    }

    /**
     * Verifies the max-heap property over the active region and the
     * consistency of the position map with the array.
     *
     * @return always {@code true} so that it can be used in an assertion.
     * @throws IllegalStateException if any invariant is broken.
     */
    boolean checkInvariants() {
        if (positions.size() != size) {
            throw new IllegalStateException(
                    "Position map has "
                            + positions.size()
                            + " entries, heap has "
                            + size
                            + " tasks.");
        }

        for (int i = 0; i < size; ++i) {
            Task task = heap[i];
            Integer position = positions.get(task.getTaskId());

            if (position == null || position != i) {
                throw new IllegalStateException(
                        "Task "
                                + task.getTaskId()
                                + " is at index "
                                + i
                                + " but mapped to "
                                + position);
            }

            if (task.getOwner() != this) {
                throw new IllegalStateException(
                        "Task " + task.getTaskId() + " is not owned by this queue.");
            }

            if (i > 0 && hasHigherPriority(task, heap[(i - 1) >>> 1])) {
                throw new IllegalStateException(
                        "Heap order broken at index " + i);
            }
        }

        for (int i = size; i < heap.length; ++i) {
            if (heap[i] != null) {
                throw new IllegalStateException(
                        "Stale task beyond the active region at index " + i);
            }
        }

        return true;
    }

    private int indexOf(String taskId) {
        Objects.requireNonNull(taskId, "The task ID is null.");
        Integer index = positions.get(taskId);

        if (index == null) {
            throw new UnknownIdException(taskId);
        }

        return index;
    }

    private static boolean hasHigherPriority(Task a, Task b) {
        if (a.getPriority() != b.getPriority()) {
            return a.getPriority() > b.getPriority();
        }

        if (a.getArrivalTime() != b.getArrivalTime()) {
            return a.getArrivalTime() < b.getArrivalTime();
        }

        return a.getTaskId().compareTo(b.getTaskId()) < 0;
    }

    private void siftUp(int i) {
        while (i > 0) {
            int parent = (i - 1) >>> 1;

            if (!hasHigherPriority(heap[i], heap[parent])) {
                return;
            }

            swap(parent, i);
            i = parent;
        }
    }

    private void siftDown(int i) {
        while (true) {
            int left = (i << 1) + 1;

            if (left >= size) {
                return;
            }

            int right = left + 1;
            int best = left;

            if (right < size && hasHigherPriority(heap[right], heap[left])) {
                best = right;
            }

            if (!hasHigherPriority(heap[best], heap[i])) {
                return;
            }

            swap(i, best);
            i = best;
        }
    }

    private void swap(int i, int j) {
        Task tmp = heap[i];
        heap[i] = heap[j];
        heap[j] = tmp;

        positions.put(heap[i].getTaskId(), i);
        positions.put(heap[j].getTaskId(), j);
    }

    private void ensureCapacity() {
        if (size == heap.length) {
            Task[] newHeap = new Task[2 * size];

            System.arraycopy(heap,
                             0,
                             newHeap,
                             0,
                             size);

            heap = newHeap;
        }
    }
}
