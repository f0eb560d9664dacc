package com.propertyintel.price.model;

import java.util.Map;

/**
 * A frame whose categorical columns were replaced by integer codes, and the
 * mappings used to do it. The mappings are needed to encode query rows the same way.
 */
public record EncodedFrame(FeatureFrame frame, Map<String, CategoryMapping> mappings) {

    public EncodedFrame {
        mappings = Map.copyOf(mappings);
    }

    public CategoryMapping mapping(String column) {
        CategoryMapping mapping = mappings.get(column);
        if (mapping == null) {
            throw new IllegalArgumentException("Column '" + column + "' was not encoded");
        }
        return mapping;
    }
}
