package com.phillippitts.lossguard.service.monitor.window;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Bounded FIFO window of the most recent training losses.
 *
 * <p>When full, pushing a value drops the oldest one. Read operations never mutate the
 * window. Not thread-safe; owned by a single monitor.
 */
public final class RollingLossWindow {

    private final int capacity;
    private final Deque<Double> losses = new ArrayDeque<>();

    public RollingLossWindow(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, was " + capacity);
        }
        this.capacity = capacity;
    }

    public int size() {
        return losses.size();
    }

    public boolean isFull() {
        return losses.size() == capacity;
    }

    public void push(double loss) {
        if (losses.size() == capacity) {
            losses.removeFirst();
        }
        losses.addLast(loss);
    }

    /**
     * Arithmetic mean of the current contents.
     *
     * @throws IllegalStateException if the window is empty
     */
    public double mean() {
        requireNonEmpty("mean");
        double sum = 0.0;
        for (double loss : losses) {
            sum += loss;
        }
        return sum / losses.size();
    }

    /**
     * Largest loss currently in the window.
     *
     * @throws IllegalStateException if the window is empty
     */
    public double max() {
        requireNonEmpty("max");
        double max = Double.NEGATIVE_INFINITY;
        for (double loss : losses) {
            max = Math.max(max, loss);
        }
        return max;
    }

    /**
     * Number of losses strictly greater than {@code threshold}.
     */
    public int countExceeding(double threshold) {
        int count = 0;
        for (double loss : losses) {
            if (loss > threshold) {
                count++;
            }
        }
        return count;
    }

    /**
     * Immutable copy of the contents, oldest first.
     */
    public List<Double> snapshot() {
        return List.copyOf(losses);
    }

    private void requireNonEmpty(String operation) {
        if (losses.isEmpty()) {
            throw new IllegalStateException("Cannot compute " + operation + " of an empty loss window");
        }
    }
}
