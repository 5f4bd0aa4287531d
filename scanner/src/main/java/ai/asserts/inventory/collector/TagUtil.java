/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory.collector;

import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.Function;

public final class TagUtil {
    private TagUtil() {
    }

    /**
     * Converts the tags of an SDK model into a sorted map. Returns <code>null</code> when there are no tags so the
     * field is left out of the document.
     */
    public static <T> SortedMap<String, String> toMap(List<T> tags, Function<T, String> key,
                                                      Function<T, String> value) {
        if (tags == null || tags.isEmpty()) {
            return null;
        }
        SortedMap<String, String> tagMap = new TreeMap<>();
        tags.forEach(tag -> tagMap.put(key.apply(tag), value.apply(tag) != null ? value.apply(tag) : ""));
        return tagMap;
    }
}
