package playback;

import java.util.Arrays;
import java.util.Random;
import lombok.NonNull;

/** A random permutation of playlist indices, regenerated with a Fisher-Yates shuffle. */
public class ShuffleOrder {

    private final Random random;
    private int[] order = new int[0];

    public ShuffleOrder(@NonNull Random random) {
        this.random = random;
    }

    public void regenerate(int size) {
        int[] next = new int[size];
        for (int i = 0; i < size; i++) {
            next[i] = i;
        }
        for (int i = size - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            int swap = next[i];
            next[i] = next[j];
            next[j] = swap;
        }
        order = next;
    }

    public boolean isEmpty() {
        return order.length == 0;
    }

    public int size() {
        return order.length;
    }

    public int get(int position) {
        return order[position];
    }

    /** Position of {@code index} in the order, or -1. */
    public int positionOf(int index) {
        for (int i = 0; i < order.length; i++) {
            if (order[i] == index) {
                return i;
            }
        }
        return -1;
    }

    public int[] toArray() {
        return order.clone();
    }

    @Override
    public String toString() {
        return Arrays.toString(order);
    }
}
