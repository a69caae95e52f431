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

import java.util.function.DoubleUnaryOperator;

import org.symcalc.exceptions.UnsupportedExpressionException;
import org.symcalc.expressions.AbstractExpression;
import org.symcalc.integration.SymbolicIntegration;
import org.symcore.logging.SymLogger;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

/**
 * Bridges the symbolic engine and numeric approximations: evaluates
 * expressions numerically, falls back to quadrature when an integrand has
 * no symbolic antiderivative, and reports how far the two disagree.
 */
public class HybridCalculus {
    private static final SymLogger calculusLog = new SymLogger("CALCULUS");

    private final CalculusConfig m_config;
    private final SymbolicIntegration m_pipeline;

    public HybridCalculus() {
        this(CalculusConfig.getDefault(), SymbolicIntegration.getDefault());
    }

    public HybridCalculus(CalculusConfig config) {
        this(config, SymbolicIntegration.withConfig(config));
    }

    public HybridCalculus(CalculusConfig config, SymbolicIntegration pipeline) {
        m_config = Preconditions.checkNotNull(config);
        m_pipeline = Preconditions.checkNotNull(pipeline);
    }

    public CalculusConfig getConfig() {
        return m_config;
    }

    public double evaluateDerivative(AbstractExpression expr, String variable, double at) {
        return NumericalCalculus.derivative(asFunction(expr, variable), at, m_config.getNumericStep());
    }

    public double evaluateIntegral(AbstractExpression expr, String variable, double a, double b) {
        return NumericalCalculus.simpson(asFunction(expr, variable), a, b, m_config.getSimpsonIntervals());
    }

    /**
     * Definite integral over [a, b], symbolic when the pipeline can
     * integrate expr, otherwise by Simpson's rule if the fallback is enabled.
     *
     * @throws UnsupportedExpressionException if there is no antiderivative
     *         and the numeric fallback is disabled
     */
    public double integrate(AbstractExpression expr, String variable, double a, double b) {
        try {
            return SymbolicCalculus.definiteIntegral(m_pipeline, expr, variable, a, b);
        }
        catch (UnsupportedExpressionException e) {
            if (!m_config.isNumericFallbackEnabled()) {
                throw e;
            }
            calculusLog.infoFmt("No antiderivative for %s, integrating over [%s, %s] numerically", expr, a, b);
            return evaluateIntegral(expr, variable, a, b);
        }
    }

    /**
     * @throws UnsupportedExpressionException if expr has no symbolic
     *         antiderivative
     */
    public CalculusComparison compareResults(AbstractExpression expr, String variable, double at, double a, double b) {
        double symbolicDerivative = Differentiator.differentiate(expr, variable).evaluate(ImmutableMap.of(variable, at));
        double numericalDerivative = evaluateDerivative(expr, variable, at);
        double symbolicIntegral = SymbolicCalculus.definiteIntegral(m_pipeline, expr, variable, a, b);
        double numericalIntegral = evaluateIntegral(expr, variable, a, b);
        return new CalculusComparison(symbolicDerivative, numericalDerivative, symbolicIntegral, numericalIntegral);
    }

    private static DoubleUnaryOperator asFunction(AbstractExpression expr, String variable) {
        return x -> expr.evaluate(ImmutableMap.of(variable, x));
    }
}
