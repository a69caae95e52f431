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


package org.symcalc.integration;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.symcalc.expressions.ExpressionUtil.add;
import static org.symcalc.expressions.ExpressionUtil.constant;
import static org.symcalc.expressions.ExpressionUtil.cos;
import static org.symcalc.expressions.ExpressionUtil.ln;
import static org.symcalc.expressions.ExpressionUtil.multiply;
import static org.symcalc.expressions.ExpressionUtil.negate;
import static org.symcalc.expressions.ExpressionUtil.pow;
import static org.symcalc.expressions.ExpressionUtil.sin;
import static org.symcalc.expressions.ExpressionUtil.variable;

import org.junit.Test;
import org.symcalc.calculus.CalculusConfig;
import org.symcalc.expressions.VariableExpression;
import org.symcalc.integration.DerivativeMatcher.MatchMode;

public class TestDerivativeMatcher {
    private final VariableExpression x = variable("x");
    private final VariableExpression y = variable("y");

    private final DerivativeMatcher canonical = new DerivativeMatcher(CalculusConfig.builder().build());
    private final DerivativeMatcher sampling =
            new DerivativeMatcher(CalculusConfig.builder().setMatchMode(MatchMode.SAMPLING).build());

    @Test
    public void testModes() {
        assertEquals(MatchMode.CANONICAL, canonical.getMode());
        assertEquals(MatchMode.SAMPLING, sampling.getMode());
    }

    @Test
    public void testCanonicalIdentical() {
        assertEquals(1.0, canonical.constantRatio(multiply(constant(2), x), multiply(x, constant(2)), x), 0.0);
        // unsimplified forms render the same once simplified
        assertEquals(1.0, canonical.constantRatio(x, multiply(pow(x, 1), constant(1)), x), 0.0);
        assertEquals(1.0, canonical.constantRatio(cos(x), cos(x), x), 0.0);
    }

    @Test
    public void testCanonicalPeelsCoefficients() {
        assertEquals(0.5, canonical.constantRatio(x, multiply(constant(2), x), x), 0.0);
        assertEquals(1.5, canonical.constantRatio(multiply(constant(3), x), multiply(constant(2), x), x), 0.0);
        assertEquals(3.0, canonical.constantRatio(constant(6), constant(2), x), 0.0);
    }

    @Test
    public void testCanonicalMismatches() {
        assertNull(canonical.constantRatio(sin(x), cos(x), x));
        assertNull(canonical.constantRatio(x, constant(1), x));
        assertNull(canonical.constantRatio(y, constant(1), x));
        assertNull(canonical.constantRatio(constant(0), multiply(constant(2), x), x));
        assertNull(canonical.constantRatio(constant(3), constant(0), x));
        // equal in value but not in printed form
        assertNull(canonical.constantRatio(add(constant(1), x), add(x, constant(1)), x));
    }

    @Test
    public void testSampling() {
        assertEquals(1.0, sampling.constantRatio(add(constant(1), x), add(x, constant(1)), x), 1e-12);
        assertEquals(3.0, sampling.constantRatio(multiply(constant(3), pow(x, 2)), pow(x, 2), x), 1e-12);
        assertEquals(-0.5, sampling.constantRatio(negate(x), multiply(constant(2), x), x), 1e-12);
        assertEquals(1.0, sampling.constantRatio(cos(x), cos(x), x), 0.0);
    }

    @Test
    public void testSamplingMismatches() {
        assertNull(sampling.constantRatio(pow(x, 2), x, x));
        assertNull(sampling.constantRatio(sin(x), cos(x), x));
        assertNull(sampling.constantRatio(y, constant(1), x));
        assertNull(sampling.constantRatio(constant(0), x, x));
        // defined nowhere on the sample points
        assertNull(sampling.constantRatio(ln(negate(x)), ln(negate(x)), x));
    }

    @Test
    public void testSubstitutionScalesByRatio() {
        DerivativeMatcher matcher = mock(DerivativeMatcher.class);
        when(matcher.constantRatio(any(), any(), eq(x))).thenReturn(2.0);
        SubstitutionStrategy rule = new SubstitutionStrategy(matcher);

        assertEquals(multiply(constant(2), negate(cos(x))),
                     rule.tryIntegrate(multiply(sin(x), y), x, SymbolicIntegration.getDefault()));
        verify(matcher).constantRatio(y, constant(1), x);
    }
}
