package com.mdtable.app.formula;

import com.mdtable.app.models.Value;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Single-argument functions reducing a matrix to one number.
 * A scalar argument passes through unchanged, except for count which gives 1.
 */
public enum AggregateFunction {
    SUM {
        @Override
        BigDecimal reduce(Value.Matrix m, MathContext mc) {
            return total(m);
        }
    },
    AVG {
        @Override
        BigDecimal reduce(Value.Matrix m, MathContext mc) {
            if (m.size() == 0) {
                return BigDecimal.ZERO;
            }
            return total(m).divide(BigDecimal.valueOf(m.size()), mc);
        }
    },
    MIN {
        @Override
        BigDecimal reduce(Value.Matrix m, MathContext mc) {
            BigDecimal min = m.size() == 0 ? BigDecimal.ZERO : m.get(0);
            for (int i = 1; i < m.size(); i++) {
                if (m.get(i).compareTo(min) < 0) {
                    min = m.get(i);
                }
            }
            return min;
        }
    },
    MAX {
        @Override
        BigDecimal reduce(Value.Matrix m, MathContext mc) {
            BigDecimal max = m.size() == 0 ? BigDecimal.ZERO : m.get(0);
            for (int i = 1; i < m.size(); i++) {
                if (m.get(i).compareTo(max) > 0) {
                    max = m.get(i);
                }
            }
            return max;
        }
    },
    COUNT {
        @Override
        BigDecimal reduce(Value.Matrix m, MathContext mc) {
            return BigDecimal.valueOf(m.size());
        }

        @Override
        public Value apply(Value arg, MathContext mc) {
            if (arg instanceof Value.Scalar) {
                return Value.scalar(BigDecimal.ONE);
            }
            return super.apply(arg, mc);
        }
    },
    PROD {
        @Override
        BigDecimal reduce(Value.Matrix m, MathContext mc) {
            // Empty product is the multiplicative identity
            BigDecimal product = BigDecimal.ONE;
            for (BigDecimal d : m.getData()) {
                product = product.multiply(d);
            }
            return product;
        }
    };

    private static final Map<String, AggregateFunction> byName = new HashMap<>();

    static {
        for (AggregateFunction f : values()) {
            byName.put(f.functionName(), f);
        }
    }

    /**
     * Case-insensitive lookup, null if there is no such function.
     */
    public static AggregateFunction forName(String name) {
        return byName.get(name.toLowerCase(Locale.ROOT));
    }

    /**
     * Comma separated list of the names, for error messages.
     */
    public static String names() {
        return Arrays.stream(values()).map(AggregateFunction::functionName).collect(Collectors.joining(", "));
    }

    public String functionName() {
        return name().toLowerCase(Locale.ROOT);
    }

    abstract BigDecimal reduce(Value.Matrix m, MathContext mc);

    public Value apply(Value arg, MathContext mc) {
        if (arg instanceof Value.Scalar) {
            return arg;
        }
        return Value.scalar(reduce((Value.Matrix) arg, mc));
    }

    private static BigDecimal total(Value.Matrix m) {
        BigDecimal sum = BigDecimal.ZERO;
        for (BigDecimal d : m.getData()) {
            sum = sum.add(d);
        }
        return sum;
    }
}
