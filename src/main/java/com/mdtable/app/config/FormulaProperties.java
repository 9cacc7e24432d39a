package com.mdtable.app.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Numeric settings of the formula engine, bound from "mdtable.formula.*".
 */
@ConfigurationProperties(prefix = "mdtable.formula")
public class FormulaProperties {

    // Significant digits kept by division, averages and negative powers
    private int precision = 28;
    private RoundingMode rounding = RoundingMode.HALF_EVEN;

    public int getPrecision() {
        return precision;
    }

    public void setPrecision(int precision) {
        this.precision = precision;
    }

    public RoundingMode getRounding() {
        return rounding;
    }

    public void setRounding(RoundingMode rounding) {
        this.rounding = rounding;
    }

    public MathContext toMathContext() {
        if (precision <= 0) {
            throw new IllegalStateException("mdtable.formula.precision must be positive, got " + precision);
        }
        return new MathContext(precision, rounding);
    }
}
