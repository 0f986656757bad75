package com.climbassessment.common.buffer;

import java.util.ArrayList;
import java.util.List;

/**
 * Fixed-capacity ring of samples for one joint. Appending to a full track
 * overwrites the oldest sample; nothing ever blocks.
 */
final class JointTrack {

    private final JointSample[] ring;
    private int head;
    private int size;
    private JointSample lastObserved;

    JointTrack(int capacity) {
        this.ring = new JointSample[capacity];
    }

    /** @return true when the append evicted the oldest sample */
    boolean append(JointSample sample) {
        boolean evicted = size == ring.length;
        ring[(head + size) % ring.length] = sample;
        if (evicted) {
            head = (head + 1) % ring.length;
        } else {
            size++;
        }
        if (sample.isObserved()) {
            lastObserved = sample;
        }
        return evicted;
    }

    /** Sample at {@code position}, 0 being the oldest retained. */
    JointSample get(int position) {
        if (position < 0 || position >= size) {
            throw new IndexOutOfBoundsException("position " + position + " outside [0, " + size + ")");
        }
        return ring[(head + position) % ring.length];
    }

    JointSample latest() {
        return size == 0 ? null : get(size - 1);
    }

    JointSample lastObserved() {
        return lastObserved;
    }

    int size() {
        return size;
    }

    List<JointSample> snapshot() {
        List<JointSample> copy = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            copy.add(get(i));
        }
        return copy;
    }
}
