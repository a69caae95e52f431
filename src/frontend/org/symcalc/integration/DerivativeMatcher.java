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

package org.symcalc.integration;

import java.util.Map;

import org.symcalc.calculus.CalculusConfig;
import org.symcalc.exceptions.EvaluationException;
import org.symcalc.expressions.AbstractExpression;
import org.symcalc.expressions.ConstantValueExpression;
import org.symcalc.expressions.VariableExpression;
import org.symcalc.types.ExpressionType;

import com.google.common.collect.ImmutableMap;

/**
 * Decides whether a candidate expression is a constant multiple of the
 * derivative of a substitution's inner function, and if so by what factor.
 */
public class DerivativeMatcher {

    public enum MatchMode {
        /// compare simplified, printed forms after peeling literal coefficients
        CANONICAL,
        /// compare values at sample points of the variable
        SAMPLING
    }

    // sample points start away from zero so ln, 1/x and sqrt stay defined
    private static final double SAMPLE_START = 0.3;
    private static final double SAMPLE_STEP = 0.7;

    private final MatchMode m_mode;
    private final int m_samplingPoints;
    private final double m_tolerance;

    public DerivativeMatcher(CalculusConfig config) {
        m_mode = config.getMatchMode();
        m_samplingPoints = config.getSamplingPoints();
        m_tolerance = config.getSamplingTolerance();
    }

    public MatchMode getMode() {
        return m_mode;
    }

    /**
     * @return c such that candidate equals c * derivative, or null when the
     *         two are not related by a non-zero constant factor
     */
    public Double constantRatio(AbstractExpression candidate,
                                AbstractExpression derivative,
                                VariableExpression variable) {
        if (m_mode == MatchMode.SAMPLING) {
            return sampledRatio(candidate, derivative, variable);
        }
        return canonicalRatio(candidate, derivative, variable);
    }

    private static Double canonicalRatio(AbstractExpression candidate,
                                         AbstractExpression derivative,
                                         VariableExpression variable) {
        AbstractExpression left = candidate.simplify();
        AbstractExpression right = derivative.simplify();
        if (canonicalForm(left, variable).equals(canonicalForm(right, variable))) {
            return 1.0;
        }

        Term leftTerm = Term.peel(left, variable);
        Term rightTerm = Term.peel(right, variable);
        if (leftTerm == null || rightTerm == null || rightTerm.m_coefficient == 0.0 || leftTerm.m_coefficient == 0.0) {
            return null;
        }
        if (leftTerm.m_rest == null || rightTerm.m_rest == null) {
            // both must be pure constants to match
            if (leftTerm.m_rest == null && rightTerm.m_rest == null) {
                return leftTerm.m_coefficient / rightTerm.m_coefficient;
            }
            return null;
        }
        if (canonicalForm(leftTerm.m_rest, variable).equals(canonicalForm(rightTerm.m_rest, variable))) {
            return leftTerm.m_coefficient / rightTerm.m_coefficient;
        }
        return null;
    }

    private static String canonicalForm(AbstractExpression expr, VariableExpression variable) {
        String name = variable.getName();
        return expr.explain().replace(" ", "").replace("(" + name + "^1)", name);
    }

    private Double sampledRatio(AbstractExpression candidate,
                                AbstractExpression derivative,
                                VariableExpression variable) {
        Double ratio = null;
        for (int ii = 0; ii < m_samplingPoints; ii++) {
            Map<String, Double> bindings = ImmutableMap.of(variable.getName(), SAMPLE_START + ii * SAMPLE_STEP);
            double top;
            double bottom;
            try {
                top = candidate.evaluate(bindings);
                bottom = derivative.evaluate(bindings);
            }
            catch (EvaluationException e) {
                // another free symbol, cannot be a constant multiple
                return null;
            }
            if (!Double.isFinite(top) || !Double.isFinite(bottom)) {
                continue;
            }
            if (bottom == 0.0 || top == 0.0) {
                if (bottom == top) {
                    continue;
                }
                return null;
            }
            double pointRatio = top / bottom;
            if (ratio == null) {
                ratio = pointRatio;
            }
            else if (Math.abs(pointRatio - ratio) > m_tolerance * Math.max(1.0, Math.abs(ratio))) {
                return null;
            }
        }
        if (ratio == null) {
            return null;
        }
        double snapped = Math.rint(ratio * 1e9) / 1e9;
        if (Math.abs(snapped - ratio) <= m_tolerance * Math.max(1.0, Math.abs(ratio))) {
            return snapped;
        }
        return ratio;
    }

    /**
     * An expression split into a literal coefficient and the rest. A rest
     * of null means the whole expression is the constant coefficient.
     */
    private static final class Term {
        final double m_coefficient;
        final AbstractExpression m_rest;

        private Term(double coefficient, AbstractExpression rest) {
            m_coefficient = coefficient;
            m_rest = rest;
        }

        static Term peel(AbstractExpression expr, VariableExpression variable) {
            if (expr.getExpressionType() == ExpressionType.OPERATOR_MULTIPLY) {
                if (expr.getLeft() instanceof ConstantValueExpression) {
                    return new Term(((ConstantValueExpression) expr.getLeft()).getValue(), expr.getRight());
                }
                if (expr.getRight() instanceof ConstantValueExpression) {
                    return new Term(((ConstantValueExpression) expr.getRight()).getValue(), expr.getLeft());
                }
            }
            if (expr.containsVariable(variable)) {
                return new Term(1.0, expr);
            }
            try {
                double value = expr.evaluate();
                return Double.isFinite(value) ? new Term(value, null) : null;
            }
            catch (EvaluationException e) {
                // free symbols other than the variable
                return null;
            }
        }
    }
}
