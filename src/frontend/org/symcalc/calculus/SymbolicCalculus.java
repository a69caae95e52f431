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

import static org.symcalc.expressions.ExpressionUtil.add;
import static org.symcalc.expressions.ExpressionUtil.constant;
import static org.symcalc.expressions.ExpressionUtil.divide;
import static org.symcalc.expressions.ExpressionUtil.multiply;
import static org.symcalc.expressions.ExpressionUtil.pow;
import static org.symcalc.expressions.ExpressionUtil.subtract;

import org.symcalc.exceptions.EvaluationException;
import org.symcalc.expressions.AbstractExpression;
import org.symcalc.expressions.ConstantValueExpression;
import org.symcalc.expressions.VariableExpression;
import org.symcalc.integration.SymbolicIntegration;
import org.symcore.logging.SymLogger;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

/**
 * Calculus operations built on the differentiator and the default
 * integration pipeline, addressed by variable name.
 */
public final class SymbolicCalculus {
    private static final SymLogger calculusLog = new SymLogger("CALCULUS");

    /// terms whose coefficient is this small are left out of a series
    static final double SERIES_EPSILON = 1e-10;

    /// step sizes used to approach a point, coarsest first
    private static final double[] LIMIT_STEPS = {1e-2, 1e-3, 1e-4, 1e-5, 1e-6, 1e-7, 1e-8};
    /// one-sided limits further apart than this mean the limit does not exist
    static final double LIMIT_AGREEMENT = 1e-4;

    /**
     * Side from which {@link #limit} approaches the point.
     */
    public enum LimitDirection {
        LEFT,
        RIGHT,
        BOTH;

        /**
         * @param name "left", "right" or "both", in any case
         * @throws IllegalArgumentException for any other name
         */
        public static LimitDirection fromName(String name) {
            Preconditions.checkArgument(name != null, "limit direction must not be null");
            for (LimitDirection direction : values()) {
                if (direction.name().equalsIgnoreCase(name.trim())) {
                    return direction;
                }
            }
            throw new IllegalArgumentException(
                    "Direction must be \"left\", \"right\", or \"both\", got \"" + name + "\"");
        }
    }

    private SymbolicCalculus() {}

    /**
     * Derivative with respect to one variable, every other symbol held
     * constant.
     */
    public static AbstractExpression partialDerivative(AbstractExpression expr, String variable) {
        return Differentiator.differentiate(expr, variable);
    }

    public static AbstractExpression nthDerivative(AbstractExpression expr, String variable, int order) {
        return Differentiator.nthDerivative(expr, new VariableExpression(variable), order);
    }

    /**
     * @throws org.symcalc.exceptions.UnsupportedExpressionException if no
     *         integration strategy applies
     */
    public static AbstractExpression indefiniteIntegral(AbstractExpression expr, String variable) {
        return SymbolicIntegration.integrate(expr, variable);
    }

    /**
     * F(b) - F(a) for the antiderivative F found by the default pipeline.
     */
    public static double definiteIntegral(AbstractExpression expr, String variable, double a, double b) {
        return definiteIntegral(SymbolicIntegration.getDefault(), expr, variable, a, b);
    }

    static double definiteIntegral(SymbolicIntegration pipeline,
                                   AbstractExpression expr, String variable, double a, double b) {
        AbstractExpression antiderivative = pipeline.integrateExpression(expr, new VariableExpression(variable));
        return antiderivative.evaluate(ImmutableMap.of(variable, b))
                - antiderivative.evaluate(ImmutableMap.of(variable, a));
    }

    /**
     * Taylor polynomial of the given order about point, the sum over k of
     * f^(k)(point) (x - point)^k / k!. Negligible terms are dropped. If a
     * derivative cannot be evaluated at the point the series ends with the
     * terms found so far.
     */
    public static AbstractExpression taylorSeries(AbstractExpression expr, String variable, double point, int order) {
        Preconditions.checkArgument(order >= 0, "series order must be non-negative, got %s", order);

        VariableExpression x = new VariableExpression(variable);
        AbstractExpression offset = (point == 0.0) ? x : subtract(x, constant(point));
        AbstractExpression result = ConstantValueExpression.ZERO;
        AbstractExpression derivative = expr;
        double factorial = 1;

        for (int k = 0; k <= order; k++) {
            if (k > 0) {
                factorial *= k;
            }
            double coefficient;
            try {
                coefficient = derivative.evaluate(ImmutableMap.of(variable, point));
            }
            catch (EvaluationException e) {
                calculusLog.debugFmt("Taylor series of %s stops at order %d: %s", expr, k, e.getMessage());
                break;
            }

            if (Double.isFinite(coefficient) && Math.abs(coefficient) > SERIES_EPSILON) {
                AbstractExpression term = constant(coefficient);
                if (k > 0) {
                    AbstractExpression power = (k == 1) ? offset : pow(offset, k);
                    term = divide(multiply(term, power), constant(factorial));
                }
                result = add(result, term);
            }

            if (k < order) {
                derivative = Differentiator.differentiate(derivative, x).simplify();
            }
        }
        return result.simplify();
    }

    /**
     * Limit of expr as variable approaches value from both sides.
     * @see #limit(AbstractExpression, String, double, LimitDirection)
     */
    public static double limit(AbstractExpression expr, String variable, double value) {
        return limit(expr, variable, value, LimitDirection.BOTH);
    }

    public static double limit(AbstractExpression expr, String variable, double value, String direction) {
        return limit(expr, variable, value, LimitDirection.fromName(direction));
    }

    /**
     * Numeric limit. The expression is evaluated at value +/- h for h from
     * 1e-2 down to 1e-8, and the finite value at the smallest step wins.
     * Steps that cannot be evaluated or give a non-finite value are
     * skipped. For {@link LimitDirection#BOTH} the one-sided limits must
     * agree within {@value #LIMIT_AGREEMENT}, and their mean is returned.
     *
     * @return the limit, or NaN if it does not exist or no step could be
     *         evaluated
     */
    public static double limit(AbstractExpression expr, String variable, double value, LimitDirection direction) {
        Preconditions.checkNotNull(direction, "limit direction must not be null");
        switch (direction) {
            case LEFT:
                return oneSidedLimit(expr, variable, value, -1.0);
            case RIGHT:
                return oneSidedLimit(expr, variable, value, 1.0);
            default:
                double right = oneSidedLimit(expr, variable, value, 1.0);
                double left = oneSidedLimit(expr, variable, value, -1.0);
                if (Double.isNaN(right) || Double.isNaN(left)) {
                    return Double.NaN;
                }
                if (Math.abs(right - left) >= LIMIT_AGREEMENT) {
                    calculusLog.debugFmt("Limit of %s at %s=%s differs by side: left %s, right %s",
                            expr, variable, value, left, right);
                    return Double.NaN;
                }
                return (right + left) / 2;
        }
    }

    private static double oneSidedLimit(AbstractExpression expr, String variable, double value, double sign) {
        double last = Double.NaN;
        for (double h : LIMIT_STEPS) {
            double at = value + sign * h;
            double result;
            try {
                result = expr.evaluate(ImmutableMap.of(variable, at));
            }
            catch (EvaluationException e) {
                calculusLog.traceFmt("Limit step %s=%s skipped: %s", variable, at, e.getMessage());
                continue;
            }
            if (Double.isFinite(result)) {
                last = result;
            }
        }
        return last;
    }

    public static AbstractExpression maclaurinSeries(AbstractExpression expr, String variable, int order) {
        return taylorSeries(expr, variable, 0.0, order);
    }
}
