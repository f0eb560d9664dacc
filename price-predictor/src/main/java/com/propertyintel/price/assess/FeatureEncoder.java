package com.propertyintel.price.assess;

import com.propertyintel.price.exception.DegenerateFeatureException;
import com.propertyintel.price.model.CategoryMapping;
import com.propertyintel.price.model.EncodedFrame;
import com.propertyintel.price.model.FeatureFrame;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Ordinal encoding of categorical columns and z-score normalisation of numeric ones.
 * Both return new frames and keep no state between calls.
 */
@Component
public class FeatureEncoder {

    /**
     * Replace each named column with integer codes derived from the values in this frame.
     * String columns are coded in lexicographic order; numeric columns in numeric order,
     * so a column that already holds codes 0..k-1 comes back unchanged.
     */
    public EncodedFrame encode(FeatureFrame frame, List<String> categoricalColumns) {
        Map<String, CategoryMapping> mappings = new LinkedHashMap<>();
        for (String column : categoricalColumns) {
            mappings.put(column, deriveMapping(frame, column));
        }
        return apply(frame, mappings);
    }

    /**
     * Encode with mappings derived earlier, e.g. a query row with the training run's codes.
     *
     * @throws com.propertyintel.price.exception.UnknownCategoryException for a value the mapping has not seen
     */
    public EncodedFrame encode(FeatureFrame frame, Map<String, CategoryMapping> mappings) {
        return apply(frame, mappings);
    }

    /**
     * Centre and scale each named column by this frame's own mean and sample standard deviation.
     *
     * @throws DegenerateFeatureException when a column has zero variance or fewer than two rows
     */
    public FeatureFrame normalize(FeatureFrame frame, List<String> numericColumns) {
        FeatureFrame result = frame;
        for (String column : numericColumns) {
            double[] values = frame.numeric(column);
            if (values.length < 2) {
                throw new DegenerateFeatureException(column);
            }

            double mean = 0;
            for (double v : values) mean += v;
            mean /= values.length;

            double squares = 0;
            for (double v : values) squares += (v - mean) * (v - mean);
            double std = Math.sqrt(squares / (values.length - 1));

            if (std == 0 || !Double.isFinite(std)) {
                throw new DegenerateFeatureException(column);
            }

            double[] scaled = new double[values.length];
            for (int i = 0; i < values.length; i++) {
                scaled[i] = (values[i] - mean) / std;
            }
            result = result.withNumeric(column, scaled);
        }
        return result;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private CategoryMapping deriveMapping(FeatureFrame frame, String column) {
        if (frame.isNumeric(column)) {
            TreeSet<Double> distinct = new TreeSet<>();
            for (double v : frame.numeric(column)) distinct.add(v);
            return CategoryMapping.fromOrdered(column, distinct.stream().map(FeatureEncoder::label).toList());
        }
        return CategoryMapping.fromObserved(column, frame.categorical(column));
    }

    private EncodedFrame apply(FeatureFrame frame, Map<String, CategoryMapping> mappings) {
        FeatureFrame result = frame;
        for (CategoryMapping mapping : mappings.values()) {
            String column = mapping.column();
            double[] codes = new double[frame.rowCount()];
            if (frame.isNumeric(column)) {
                double[] values = frame.numeric(column);
                for (int i = 0; i < values.length; i++) {
                    codes[i] = mapping.codeOf(label(values[i]));
                }
            } else {
                List<String> values = frame.categorical(column);
                for (int i = 0; i < values.size(); i++) {
                    codes[i] = mapping.codeOf(values.get(i));
                }
            }
            result = result.withNumeric(column, codes);
        }
        return new EncodedFrame(result, mappings);
    }

    private static String label(double value) {
        return value == Math.rint(value) && !Double.isInfinite(value)
                ? String.valueOf((long) value)
                : String.valueOf(value);
    }
}
