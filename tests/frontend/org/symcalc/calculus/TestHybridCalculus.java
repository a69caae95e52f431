/* This file is part of SymCalc.
 * Copyright (C) 2008-2022 Volt Active Data Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining
 * a copy of this software and associated documentation files (the
 * "Software"), to deal in the Software without restriction, including
 * without limitation the rights to use, copy, modify, merge, publish,
 * distribute, sublicense, and/or sell copies of the Software, and to
 * permit persons to whom the Software is furnished to do so, subject to
 * the following conditions:
 *
 * The above copyright notice and this permission notice shall be
 * included in all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND,
 * EXPRESS OR IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF
 * MERCHANTABILITY, FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT.
 * IN NO EVENT SHALL THE AUTHORS BE LIABLE FOR ANY CLAIM, DAMAGES OR
 * OTHER LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE,
 * ARISING FROM, OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR
 * OTHER DEALINGS IN THE SOFTWARE.
 */


package org.symcalc.calculus;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.symcalc.expressions.ExpressionUtil.cos;
import static org.symcalc.expressions.ExpressionUtil.multiply;
import static org.symcalc.expressions.ExpressionUtil.pow;
import static org.symcalc.expressions.ExpressionUtil.sin;
import static org.symcalc.expressions.ExpressionUtil.variable;

import java.util.Collections;

import org.junit.Test;
import org.symcalc.exceptions.UnsupportedExpressionException;
import org.symcalc.expressions.AbstractExpression;
import org.symcalc.expressions.VariableExpression;
import org.symcalc.integration.IntegrationStrategy;
import org.symcalc.integration.SymbolicIntegration;

public class TestHybridCalculus {
    private final VariableExpression x = variable("x");

    @Test
    public void testNumericEvaluation() {
        HybridCalculus hybrid = new HybridCalculus();
        assertEquals(Math.cos(0.3), hybrid.evaluateDerivative(sin(x), "x", 0.3), 1e-8);
        assertEquals(1.0 / 3, hybrid.evaluateIntegral(pow(x, 2), "x", 0, 1), 1e-12);
    }

    @Test
    public void testSymbolicIntegrationPreferred() {
        HybridCalculus hybrid = new HybridCalculus();
        assertEquals(9.0, hybrid.integrate(pow(x, 2), "x", 0, 3), 1e-12);
    }

    @Test
    public void testFallbackToSimpson() {
        HybridCalculus hybrid = new HybridCalculus(CalculusConfig.builder().build());
        // sin(x)cos(x) has no symbolic antiderivative here; the exact value is 1/2
        double value = hybrid.integrate(multiply(sin(x), cos(x)), "x", 0, Math.PI / 2);
        assertEquals(0.5, value, 1e-10);
    }

    @Test
    public void testFallbackDisabled() {
        CalculusConfig config = CalculusConfig.builder().setNumericFallback(false).build();
        HybridCalculus hybrid = new HybridCalculus(config);
        AbstractExpression integrand = multiply(sin(x), cos(x));
        try {
            hybrid.integrate(integrand, "x", 0, 1);
            fail("expected the symbolic failure to propagate");
        }
        catch (UnsupportedExpressionException e) {
            assertEquals(integrand, e.getExpression());
            assertEquals(x, e.getVariable());
        }
    }

    @Test
    public void testUsesGivenPipeline() {
        // a pipeline whose only strategy never matches forces the numeric path
        IntegrationStrategy never = mock(IntegrationStrategy.class);
        SymbolicIntegration pipeline = new SymbolicIntegration(Collections.singletonList(never));
        CalculusConfig config = CalculusConfig.builder().build();
        HybridCalculus hybrid = new HybridCalculus(config, pipeline);

        assertSame(config, hybrid.getConfig());
        assertEquals(9.0, hybrid.integrate(pow(x, 2), "x", 0, 3), 1e-9);
        verify(never, atLeastOnce()).tryIntegrate(any(), any(), any());
    }

    @Test
    public void testCompareResults() {
        HybridCalculus hybrid = new HybridCalculus();
        CalculusComparison comparison = hybrid.compareResults(pow(x, 2), "x", 1.0, 0, 2);
        assertEquals(2.0, comparison.getSymbolicDerivative(), 1e-12);
        assertEquals(2.0, comparison.getNumericalDerivative(), 1e-6);
        assertEquals(8.0 / 3, comparison.getSymbolicIntegral(), 1e-12);
        assertEquals(8.0 / 3, comparison.getNumericalIntegral(), 1e-10);
        assertTrue(comparison.getDerivativeError() < 1e-6);
        assertTrue(comparison.getIntegralError() < 1e-10);
        assertTrue(comparison.toString().contains("symbolicIntegral"));
    }
}
