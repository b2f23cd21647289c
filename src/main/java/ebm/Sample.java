package ebm;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * An ordered row of feature values, aligned with the model's main features.
 * Continuous values are held as Double, categorical values as their label
 * (String); numbers are accepted for categorical features too and are
 * encoded through their textual form.
 */
public final class Sample {
    private final Object[] values;

    private Sample(Object[] values) {
        this.values = values;
    }

    public static Sample of(Object... values) {
        return new Sample(normalise(Arrays.asList(values)));
    }

    public static Sample of(List<?> values) {
        return new Sample(normalise(values));
    }

    private static Object[] normalise(List<?> raw) {
        Object[] out = new Object[raw.size()];
        for (int i = 0; i < raw.size(); i++) {
            Object value = raw.get(i);
            if (value == null) {
                throw new IllegalArgumentException("Sample value at position " + i + " is null");
            }
            if (value instanceof Number) {
                out[i] = ((Number) value).doubleValue();
            } else {
                out[i] = value.toString();
            }
        }
        return out;
    }

    public int size() {
        return values.length;
    }

    public Object get(int index) {
        return values[index];
    }

    /**
     * Numeric view of a value; labels that parse as numbers are accepted.
     */
    public double getNumber(int index) {
        Object value = values[index];
        if (value instanceof Double) {
            return (Double) value;
        }
        try {
            return Double.parseDouble((String) value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Value '" + value + "' at position " + index + " is not numeric", e);
        }
    }

    public Sample with(int index, Object value) {
        Object[] copy = values.clone();
        copy[index] = value instanceof Number ? ((Number) value).doubleValue() : value.toString();
        return new Sample(copy);
    }

    public List<Object> asList() {
        return Collections.unmodifiableList(Arrays.asList(values.clone()));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Sample)) return false;
        return Arrays.equals(values, ((Sample) o).values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "Sample" + Arrays.toString(values);
    }
}
