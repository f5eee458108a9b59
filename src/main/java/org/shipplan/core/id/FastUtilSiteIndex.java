package org.shipplan.core.id;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.List;

/**
 * Immutable {@link SiteIndex} backed by a fastutil label-to-int map.
 *
 * <p>Safe for concurrent reads once constructed.</p>
 */
public class FastUtilSiteIndex implements SiteIndex {

    // label -> index, -1 when absent
    private final Object2IntOpenHashMap<String> forward;
    private final String[] reverse;

    /**
     * Builds the index from an ordered label list.
     *
     * @param labels ordered labels; list position becomes the index.
     * @throws IllegalArgumentException on null, blank or duplicate labels.
     */
    public FastUtilSiteIndex(List<String> labels) {
        if (labels == null) {
            throw new IllegalArgumentException("labels cannot be null");
        }
        int size = labels.size();
        this.forward = new Object2IntOpenHashMap<>(size);
        this.forward.defaultReturnValue(-1);
        this.reverse = new String[size];

        for (int i = 0; i < size; i++) {
            String label = labels.get(i);
            if (label == null || label.isBlank()) {
                throw new IllegalArgumentException("site label at index " + i + " must be non-blank");
            }
            if (forward.containsKey(label)) {
                throw new IllegalArgumentException("duplicate site label: " + label);
            }
            forward.put(label, i);
            reverse[i] = label;
        }
        this.forward.trim();
    }

    @Override
    public int toIndex(String label) throws UnknownSiteException {
        int index = forward.getInt(label);
        if (index == -1) {
            throw new UnknownSiteException("site label not found: " + label);
        }
        return index;
    }

    @Override
    public String toLabel(int index) {
        if (index < 0 || index >= reverse.length) {
            throw new IndexOutOfBoundsException("site index out of bounds: " + index);
        }
        return reverse[index];
    }

    @Override
    public boolean containsLabel(String label) {
        return forward.containsKey(label);
    }

    @Override
    public int size() {
        return reverse.length;
    }
}
