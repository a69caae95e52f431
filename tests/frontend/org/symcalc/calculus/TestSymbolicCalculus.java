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
import static org.junit.Assert.assertTrue;
import static org.symcalc.expressions.ExpressionUtil.add;
import static org.symcalc.expressions.ExpressionUtil.constant;
import static org.symcalc.expressions.ExpressionUtil.cos;
import static org.symcalc.expressions.ExpressionUtil.divide;
import static org.symcalc.expressions.ExpressionUtil.exp;
import static org.symcalc.expressions.ExpressionUtil.multiply;
import static org.symcalc.expressions.ExpressionUtil.pow;
import static org.symcalc.expressions.ExpressionUtil.sin;
import static org.symcalc.expressions.ExpressionUtil.variable;

import java.util.Collections;

import org.junit.Test;
import org.symcalc.calculus.SymbolicCalculus.LimitDirection;
import org.symcalc.exceptions.UnsupportedExpressionException;
import org.symcalc.expressions.AbstractExpression;
import org.symcalc.expressions.VariableExpression;

import com.google.common.collect.ImmutableMap;

public class TestSymbolicCalculus {
    private final VariableExpression x = variable("x");
    private final VariableExpression y = variable("y");

    private static double at(AbstractExpression expr, double value) {
        return expr.evaluate(Collections.singletonMap("x", value));
    }

    @Test
    public void testPartialDerivative() {
        AbstractExpression expr = add(multiply(pow(x, 2), y), pow(y, 3));
        AbstractExpression dy = SymbolicCalculus.partialDerivative(expr, "y");
        // x^2 + 3y^2
        assertEquals(4.0 + 3 * 9.0, dy.evaluate(ImmutableMap.of("x", 2.0, "y", 3.0)), 1e-9);
    }

    @Test
    public void testNthDerivative() {
        AbstractExpression second = SymbolicCalculus.nthDerivative(exp(multiply(constant(2), x)), "x", 2);
        assertEquals(4 * Math.exp(1.0), at(second, 0.5), 1e-9);
    }

    @Test
    public void testIndefiniteIntegral() {
        AbstractExpression integral = SymbolicCalculus.indefiniteIntegral(pow(x, 2), "x");
        assertEquals("((x^3) / 3)", integral.explain());
    }

    @Test
    public void testDefiniteIntegrals() {
        assertEquals(9.0, SymbolicCalculus.definiteIntegral(pow(x, 2), "x", 0, 3), 1e-12);
        assertEquals(2.0, SymbolicCalculus.definiteIntegral(sin(x), "x", 0, Math.PI), 1e-12);
        assertEquals(0.0, SymbolicCalculus.definiteIntegral(cos(x), "x", 1, 1), 0.0);
    }

    @Test(expected = UnsupportedExpressionException.class)
    public void testDefiniteIntegralWithoutAntiderivative() {
        SymbolicCalculus.definiteIntegral(multiply(sin(x), cos(x)), "x", 0, 1);
    }

    @Test
    public void testTaylorSeriesOfSin() {
        AbstractExpression taylor = SymbolicCalculus.taylorSeries(sin(x), "x", 0, 3);
        assertEquals(Math.sin(0.5), at(taylor, 0.5), 1e-3);
        // x - x^3/6
        assertEquals(0.5 - 0.125 / 6, at(taylor, 0.5), 1e-12);
    }

    @Test
    public void testTaylorSeriesAroundOne() {
        // x^2 = 1 + 2(x-1) + (x-1)^2
        AbstractExpression taylor = SymbolicCalculus.taylorSeries(pow(x, 2), "x", 1, 2);
        assertEquals(2.25, at(taylor, 1.5), 1e-12);

        AbstractExpression cubic = SymbolicCalculus.taylorSeries(pow(x, 3), "x", 1, 3);
        assertEquals(8.0, at(cubic, 2.0), 1e-12);
    }

    @Test
    public void testTaylorSeriesOrderZero() {
        AbstractExpression taylor = SymbolicCalculus.taylorSeries(pow(x, 3), "x", 1, 0);
        assertEquals(1.0, taylor.evaluate(), 0.0);
    }

    @Test
    public void testMaclaurinSeriesOfExp() {
        AbstractExpression series = SymbolicCalculus.maclaurinSeries(exp(x), "x", 4);
        assertEquals(1 + 0.5 + 0.125 + 0.125 / 6 + 0.0625 / 24, at(series, 0.5), 1e-12);
        assertEquals(Math.exp(0.5), at(series, 0.5), 1e-3);
    }

    @Test
    public void testTaylorSeriesStopsAtUnboundSymbol() {
        AbstractExpression taylor = SymbolicCalculus.taylorSeries(add(sin(x), y), "x", 0, 3);
        assertEquals(0.0, taylor.evaluate(), 0.0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeOrder() {
        SymbolicCalculus.taylorSeries(sin(x), "x", 0, -1);
    }

    @Test
    public void testLimitOfSinXOverX() {
        AbstractExpression expr = divide(sin(x), x);
        assertEquals(1.0, SymbolicCalculus.limit(expr, "x", 0), 1e-6);
        assertEquals(1.0, SymbolicCalculus.limit(expr, "x", 0, "left"), 1e-6);
        assertEquals(1.0, SymbolicCalculus.limit(expr, "x", 0, LimitDirection.RIGHT), 1e-6);
    }

    @Test
    public void testLimitThatDoesNotExist() {
        AbstractExpression expr = divide(constant(1), x);
        assertTrue(Double.isNaN(SymbolicCalculus.limit(expr, "x", 0)));
        assertTrue(Double.isNaN(SymbolicCalculus.limit(expr, "x", 0, "BOTH")));
        assertEquals(1e8, SymbolicCalculus.limit(expr, "x", 0, "right"), 1.0);
        assertEquals(-1e8, SymbolicCalculus.limit(expr, "x", 0, "left"), 1.0);
    }

    @Test
    public void testLimitWithUnboundSymbolIsNaN() {
        assertTrue(Double.isNaN(SymbolicCalculus.limit(add(x, y), "x", 1)));
    }

    @Test
    public void testLimitOfContinuousFunction() {
        assertEquals(Math.cos(2.0), SymbolicCalculus.limit(cos(x), "x", 2.0), 1e-6);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testLimitRejectsUnknownDirection() {
        SymbolicCalculus.limit(sin(x), "x", 0, "up");
    }
}
