package org.shipplan.core.id;

import lombok.experimental.StandardException;

import java.util.ArrayList;
import java.util.List;

/**
 * Bidirectional mapping between site labels (warehouse or destination names) and dense
 * matrix indices.
 */
public interface SiteIndex {

    /**
     * Converts a site label to its row or column index.
     *
     * @param label client-facing site label.
     * @return dense index in {@code [0, size)}.
     * @throws UnknownSiteException if the label is not mapped.
     */
    int toIndex(String label) throws UnknownSiteException;

    /**
     * Converts a dense index back to its site label.
     *
     * @param index row or column index.
     * @return site label.
     * @throws IndexOutOfBoundsException if the index is outside the mapping.
     */
    String toLabel(int index);

    /**
     * Checks whether a label is mapped.
     *
     * @param label label to test.
     * @return true when the label is present.
     */
    boolean containsLabel(String label);

    /**
     * Returns number of mapped sites.
     *
     * @return mapping size.
     */
    int size();

    /**
     * Thrown when a label cannot be found in the mapping.
     */
    @StandardException
    class UnknownSiteException extends RuntimeException {
    }

    /**
     * Creates an immutable index where position {@code i} in the list maps to index {@code i}.
     *
     * @param labels ordered, unique, non-blank labels.
     * @return immutable index.
     */
    static SiteIndex of(List<String> labels) {
        return new FastUtilSiteIndex(labels);
    }

    /**
     * Creates the default numbered labels {@code "<prefix> 1" .. "<prefix> count"}.
     *
     * @param prefix label prefix such as {@code "Warehouse"}.
     * @param count number of sites.
     * @return immutable index.
     */
    static SiteIndex numbered(String prefix, int count) {
        List<String> labels = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            labels.add(prefix + " " + i);
        }
        return new FastUtilSiteIndex(labels);
    }
}
