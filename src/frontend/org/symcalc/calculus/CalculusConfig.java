/* This file is part of SymCalc.
 * Copyright (C) 2008-2022 Volt Active Data Inc.
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with SymCalc.  If not, see <http://www.gnu.org/licenses/>.
 */

package org.symcalc.calculus;

import java.util.Locale;

import org.symcalc.integration.DerivativeMatcher.MatchMode;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

/**
 * Tunables for the calculus engine. The defaults come from system
 * properties so a deployment can switch behavior with -D flags; a
 * {@link Builder} overrides individual values in code and tests.
 */
public class CalculusConfig {

    public static final String MATCHER_PROPERTY = "symcalc.substitution.matcher";
    public static final String SAMPLING_POINTS_PROPERTY = "symcalc.sampling.points";
    public static final String SAMPLING_TOLERANCE_PROPERTY = "symcalc.sampling.tolerance";
    public static final String NUMERIC_STEP_PROPERTY = "symcalc.numeric.step";
    public static final String SIMPSON_INTERVALS_PROPERTY = "symcalc.simpson.intervals";
    public static final String HYBRID_FALLBACK_PROPERTY = "symcalc.hybrid.fallback";

    private final MatchMode m_matchMode;
    private final int m_samplingPoints;
    private final double m_samplingTolerance;
    private final double m_numericStep;
    private final int m_simpsonIntervals;
    private final boolean m_numericFallback;

    private CalculusConfig(Builder builder) {
        Preconditions.checkArgument(builder.m_samplingPoints > 0,
                "%s must be positive, got %s", SAMPLING_POINTS_PROPERTY, builder.m_samplingPoints);
        Preconditions.checkArgument(builder.m_samplingTolerance > 0,
                "%s must be positive, got %s", SAMPLING_TOLERANCE_PROPERTY, builder.m_samplingTolerance);
        Preconditions.checkArgument(builder.m_numericStep > 0,
                "%s must be positive, got %s", NUMERIC_STEP_PROPERTY, builder.m_numericStep);
        Preconditions.checkArgument(builder.m_simpsonIntervals > 0,
                "%s must be positive, got %s", SIMPSON_INTERVALS_PROPERTY, builder.m_simpsonIntervals);
        m_matchMode = Preconditions.checkNotNull(builder.m_matchMode);
        m_samplingPoints = builder.m_samplingPoints;
        m_samplingTolerance = builder.m_samplingTolerance;
        m_numericStep = builder.m_numericStep;
        // Simpson's rule needs an even number of intervals
        m_simpsonIntervals = builder.m_simpsonIntervals + (builder.m_simpsonIntervals % 2);
        m_numericFallback = builder.m_numericFallback;
    }

    private static final CalculusConfig s_default = fromSystemProperties();

    /**
     * @return the configuration read from system properties when this
     *         class was loaded
     */
    public static CalculusConfig getDefault() {
        return s_default;
    }

    public static CalculusConfig fromSystemProperties() {
        Builder builder = builder();
        String mode = System.getProperty(MATCHER_PROPERTY);
        if (mode != null) {
            builder.setMatchMode(MatchMode.valueOf(mode.trim().toUpperCase(Locale.ROOT)));
        }
        builder.setSamplingPoints(intProperty(SAMPLING_POINTS_PROPERTY, builder.m_samplingPoints));
        builder.setSamplingTolerance(doubleProperty(SAMPLING_TOLERANCE_PROPERTY, builder.m_samplingTolerance));
        builder.setNumericStep(doubleProperty(NUMERIC_STEP_PROPERTY, builder.m_numericStep));
        builder.setSimpsonIntervals(intProperty(SIMPSON_INTERVALS_PROPERTY, builder.m_simpsonIntervals));
        builder.setNumericFallback(Boolean.parseBoolean(
                System.getProperty(HYBRID_FALLBACK_PROPERTY, Boolean.toString(builder.m_numericFallback))));
        return builder.build();
    }

    private static int intProperty(String name, int defaultValue) {
        String value = System.getProperty(name);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property " + name + " is not an integer: " + value, e);
        }
    }

    private static double doubleProperty(String name, double defaultValue) {
        String value = System.getProperty(name);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property " + name + " is not a number: " + value, e);
        }
    }

    public MatchMode getMatchMode() {
        return m_matchMode;
    }

    public int getSamplingPoints() {
        return m_samplingPoints;
    }

    public double getSamplingTolerance() {
        return m_samplingTolerance;
    }

    public double getNumericStep() {
        return m_numericStep;
    }

    public int getSimpsonIntervals() {
        return m_simpsonIntervals;
    }

    public boolean isNumericFallbackEnabled() {
        return m_numericFallback;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("matchMode", m_matchMode)
                .add("samplingPoints", m_samplingPoints)
                .add("samplingTolerance", m_samplingTolerance)
                .add("numericStep", m_numericStep)
                .add("simpsonIntervals", m_simpsonIntervals)
                .add("numericFallback", m_numericFallback)
                .toString();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private MatchMode m_matchMode = MatchMode.CANONICAL;
        private int m_samplingPoints = 5;
        private double m_samplingTolerance = 1e-9;
        private double m_numericStep = 1e-5;
        private int m_simpsonIntervals = 1000;
        private boolean m_numericFallback = true;

        private Builder() {}

        public Builder setMatchMode(MatchMode matchMode) {
            m_matchMode = matchMode;
            return this;
        }

        public Builder setSamplingPoints(int samplingPoints) {
            m_samplingPoints = samplingPoints;
            return this;
        }

        public Builder setSamplingTolerance(double samplingTolerance) {
            m_samplingTolerance = samplingTolerance;
            return this;
        }

        public Builder setNumericStep(double numericStep) {
            m_numericStep = numericStep;
            return this;
        }

        public Builder setSimpsonIntervals(int simpsonIntervals) {
            m_simpsonIntervals = simpsonIntervals;
            return this;
        }

        public Builder setNumericFallback(boolean numericFallback) {
            m_numericFallback = numericFallback;
            return this;
        }

        public CalculusConfig build() {
            return new CalculusConfig(this);
        }
    }
}
