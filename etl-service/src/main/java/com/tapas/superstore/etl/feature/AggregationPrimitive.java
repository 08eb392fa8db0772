package com.tapas.superstore.etl.feature;

import com.tapas.superstore.etl.exception.FeatureComputationException;
import com.tapas.superstore.etl.schema.FieldType;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Statistics computed over the descendant rows of one ancestor row.
 * Null inputs are skipped. All results are independent of row order.
 */
public enum AggregationPrimitive {

    COUNT {
        @Override
        public FieldType resultType(FieldType inputType) {
            return FieldType.INTEGER;
        }

        @Override
        Object compute(List<?> values, FieldType inputType) {
            return (long) values.size();
        }
    },

    SUM {
        @Override
        public FieldType resultType(FieldType inputType) {
            return inputType;
        }

        @Override
        Object compute(List<?> values, FieldType inputType) {
            if (inputType == FieldType.INTEGER) {
                long total = 0;
                try {
                    for (Object value : values) {
                        total = Math.addExact(total, (Long) value);
                    }
                } catch (ArithmeticException e) {
                    throw new FeatureComputationException("Integer SUM over " + values.size() + " value(s) overflows", e);
                }
                return total;
            }
            return decimalSum(values);
        }
    },

    MEAN {
        @Override
        public FieldType resultType(FieldType inputType) {
            return FieldType.DECIMAL;
        }

        @Override
        Object compute(List<?> values, FieldType inputType) {
            if (values.isEmpty()) {
                return null;
            }
            return decimalSum(values).divide(BigDecimal.valueOf(values.size()), MathContext.DECIMAL64);
        }
    },

    MAX {
        @Override
        public FieldType resultType(FieldType inputType) {
            return inputType;
        }

        @Override
        Object compute(List<?> values, FieldType inputType) {
            return values.stream().max(ORDER).orElse(null);
        }
    },

    MIN {
        @Override
        public FieldType resultType(FieldType inputType) {
            return inputType;
        }

        @Override
        Object compute(List<?> values, FieldType inputType) {
            return values.stream().min(ORDER).orElse(null);
        }
    };

    /**
     * Numeric order. Equal decimals of different scale (2.0, 2.00) are ordered
     * by scale so the chosen value never depends on input order.
     */
    private static final Comparator<Object> ORDER = (left, right) -> {
        if (left instanceof BigDecimal l && right instanceof BigDecimal r) {
            int byValue = l.compareTo(r);
            return byValue != 0 ? byValue : Integer.compare(l.scale(), r.scale());
        }
        return Long.compare(((Number) left).longValue(), ((Number) right).longValue());
    };

    public abstract FieldType resultType(FieldType inputType);

    abstract Object compute(List<?> nonNullValues, FieldType inputType);

    /**
     * @param values   attribute values of the descendant rows, may contain nulls;
     *                 for {@link #COUNT} one entry per row
     */
    public Object apply(List<?> values, FieldType inputType) {
        if (this == COUNT) {
            return compute(values, inputType);
        }
        return compute(values.stream().filter(Objects::nonNull).toList(), inputType);
    }

    public boolean needsAttribute() {
        return this != COUNT;
    }

    private static BigDecimal decimalSum(List<?> values) {
        BigDecimal total = BigDecimal.ZERO;
        for (Object value : values) {
            total = total.add(value instanceof BigDecimal decimal
                    ? decimal
                    : BigDecimal.valueOf(((Number) value).longValue()));
        }
        return total;
    }
}
