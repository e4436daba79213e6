package com.logsentinel.core.calibration;

import java.util.Arrays;

/**
 * Fixed-capacity FIFO of anomaly scores backed by a ring buffer.
 *
 * <p>
 * Appending to a full buffer evicts the oldest score in O(1). Not thread
 * safe: instances are owned by a {@link ScoreWindow} and only touched under
 * the calibrator lock.
 * </p>
 *
 * @since 1.0.0
 */
public class BoundedScoreBuffer {

    private final double[] values;
    private int head;
    private int size;

    /**
     * @param capacity maximum number of retained scores; must be positive
     * @throws IllegalArgumentException if {@code capacity <= 0}
     */
    public BoundedScoreBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0, got: " + capacity);
        }
        this.values = new double[capacity];
    }

    /**
     * Append a score, evicting the oldest one when full.
     *
     * @param score the score to append
     */
    public void add(double score) {
        if (size < values.length) {
            values[(head + size) % values.length] = score;
            size++;
        } else {
            values[head] = score;
            head = (head + 1) % values.length;
        }
    }

    /**
     * @param index position from the oldest retained score ({@code 0})
     * @return the score at that position
     * @throws IndexOutOfBoundsException if {@code index} is outside {@code [0, size)}
     */
    public double get(int index) {
        if (index < 0 || index >= size) {
            throw new IndexOutOfBoundsException("index " + index + " out of [0, " + size + ")");
        }
        return values[(head + index) % values.length];
    }

    /**
     * @param threshold comparison value
     * @return number of retained scores strictly greater than {@code threshold}
     */
    public int countAbove(double threshold) {
        int count = 0;
        for (int i = 0; i < size; i++) {
            if (values[(head + i) % values.length] > threshold) {
                count++;
            }
        }
        return count;
    }

    /**
     * @return arithmetic mean of the retained scores, {@code 0.0} when empty
     */
    public double mean() {
        if (size == 0) {
            return 0.0;
        }
        double sum = 0;
        for (int i = 0; i < size; i++) {
            sum += values[(head + i) % values.length];
        }
        return sum / size;
    }

    public int size() {
        return size;
    }

    public int capacity() {
        return values.length;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * @return retained scores, oldest first
     */
    public double[] toArray() {
        double[] out = new double[size];
        for (int i = 0; i < size; i++) {
            out[i] = values[(head + i) % values.length];
        }
        return out;
    }

    public void clear() {
        head = 0;
        size = 0;
    }

    @Override
    public String toString() {
        return "BoundedScoreBuffer{size=" + size + ", capacity=" + values.length
                + ", values=" + Arrays.toString(toArray()) + '}';
    }
}
