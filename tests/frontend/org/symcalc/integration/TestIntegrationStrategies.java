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

import static org.symcalc.expressions.ExpressionUtil.add;
import static org.symcalc.expressions.ExpressionUtil.constant;
import static org.symcalc.expressions.ExpressionUtil.cos;
import static org.symcalc.expressions.ExpressionUtil.cot;
import static org.symcalc.expressions.ExpressionUtil.csc;
import static org.symcalc.expressions.ExpressionUtil.divide;
import static org.symcalc.expressions.ExpressionUtil.exp;
import static org.symcalc.expressions.ExpressionUtil.ln;
import static org.symcalc.expressions.ExpressionUtil.multiply;
import static org.symcalc.expressions.ExpressionUtil.negate;
import static org.symcalc.expressions.ExpressionUtil.pow;
import static org.symcalc.expressions.ExpressionUtil.sec;
import static org.symcalc.expressions.ExpressionUtil.sin;
import static org.symcalc.expressions.ExpressionUtil.subtract;
import static org.symcalc.expressions.ExpressionUtil.tan;
import static org.symcalc.expressions.ExpressionUtil.variable;

import org.symcalc.calculus.CalculusConfig;
import org.symcalc.expressions.AbstractExpression;
import org.symcalc.expressions.VariableExpression;
import org.symcalc.types.ExpressionType;

import junit.framework.TestCase;

public class TestIntegrationStrategies extends TestCase {
    private final VariableExpression x = variable("x");
    private final VariableExpression y = variable("y");
    private final SymbolicIntegration pipeline = SymbolicIntegration.getDefault();

    private AbstractExpression apply(IntegrationStrategy strategy, AbstractExpression expr) {
        return strategy.tryIntegrate(expr, x, pipeline);
    }

    public void testPowerRule() {
        PowerRuleStrategy rule = new PowerRuleStrategy();
        assertEquals(divide(pow(x, 2), constant(2)), apply(rule, x));
        assertEquals(divide(pow(x, 4), constant(4)), apply(rule, pow(x, 3)));
        assertEquals(ln(x), apply(rule, pow(x, -1)));
        // a constant exponent that is not a literal
        assertEquals(divide(pow(x, 3), constant(3)), apply(rule, pow(x, add(constant(1), constant(1)))));
        assertEquals(multiply(constant(7), x), apply(rule, constant(7)));
        assertEquals(multiply(y, x), apply(rule, y));
        assertEquals("((x^2) / 2)", apply(rule, x).explain());
    }

    public void testPowerRuleConstantMultiples() {
        PowerRuleStrategy rule = new PowerRuleStrategy();
        assertEquals(multiply(constant(3), divide(pow(x, 3), constant(3))),
                     apply(rule, multiply(constant(3), pow(x, 2))));
        assertEquals(multiply(constant(3), divide(pow(x, 3), constant(3))),
                     apply(rule, multiply(pow(x, 2), constant(3))));
        assertEquals(multiply(y, negate(cos(x))), apply(rule, multiply(y, sin(x))));
        // the other factor cannot be integrated
        assertNull(apply(rule, multiply(constant(2), multiply(sin(x), cos(x)))));
    }

    public void testPowerRuleReciprocals() {
        PowerRuleStrategy rule = new PowerRuleStrategy();
        assertEquals(ln(x), apply(rule, divide(constant(1), x)));
        assertEquals(multiply(constant(3), ln(x)), apply(rule, divide(constant(3), x)));
        assertEquals(multiply(constant(3), ln(x)), apply(rule, divide(constant(3), pow(x, 1))));
        assertEquals(multiply(constant(2), divide(pow(x, -2), constant(-2))),
                     apply(rule, divide(constant(2), pow(x, 3))));
        assertNull(apply(rule, divide(constant(1), sin(x))));
    }

    public void testPowerRuleDeclines() {
        PowerRuleStrategy rule = new PowerRuleStrategy();
        // symbolic exponent cannot be evaluated
        assertNull(apply(rule, pow(x, y)));
        assertNull(apply(rule, sin(x)));
        assertNull(apply(rule, multiply(x, sin(x))));
        assertNull(apply(rule, add(x, constant(1))));
    }

    public void testBasicTrig() {
        BasicTrigStrategy rule = new BasicTrigStrategy();
        assertEquals(negate(cos(x)), apply(rule, sin(x)));
        assertEquals(sin(x), apply(rule, cos(x)));
        assertEquals(tan(x), apply(rule, pow(sec(x), 2)));
        assertEquals(negate(cot(x)), apply(rule, pow(csc(x), 2)));
        assertEquals(sec(x), apply(rule, multiply(sec(x), tan(x))));
        assertEquals(sec(x), apply(rule, multiply(tan(x), sec(x))));
        assertEquals(negate(csc(x)), apply(rule, multiply(cot(x), csc(x))));

        assertNull(apply(rule, sin(multiply(constant(2), x))));
        assertNull(apply(rule, sin(y)));
        assertNull(apply(rule, tan(x)));
        assertNull(apply(rule, pow(sec(x), 3)));
        assertNull(apply(rule, multiply(sec(x), cot(x))));
    }

    public void testExponential() {
        ExponentialStrategy rule = new ExponentialStrategy();
        assertEquals(exp(x), apply(rule, exp(x)));
        assertEquals(divide(pow(constant(2), x), ln(constant(2))), apply(rule, pow(constant(2), x)));
        assertEquals(divide(pow(y, x), ln(y)), apply(rule, pow(y, x)));

        assertNull(apply(rule, exp(multiply(constant(2), x))));
        assertNull(apply(rule, pow(x, x)));
        assertNull(apply(rule, pow(constant(2), multiply(constant(2), x))));

        assertEquals(x, apply(rule, pow(constant(1), x)));
        assertNull(apply(rule, pow(constant(-4), x)));
        assertNull(apply(rule, pow(constant(0), x)));
        assertNull(apply(rule, pow(negate(constant(2)), x)));
    }

    public void testConstantMultiple() {
        ConstantMultipleStrategy rule = new ConstantMultipleStrategy();
        assertEquals(multiply(y, negate(cos(x))), apply(rule, multiply(y, sin(x))));
        assertEquals(multiply(constant(4), exp(x)), apply(rule, multiply(exp(x), constant(4))));
        assertEquals(negate(negate(cos(x))), apply(rule, negate(sin(x))));

        assertNull(apply(rule, multiply(sin(x), cos(x))));
        assertNull(apply(rule, negate(multiply(sin(x), cos(x)))));
        assertNull(apply(rule, sin(x)));
    }

    public void testSumDifference() {
        SumDifferenceStrategy rule = new SumDifferenceStrategy();
        AbstractExpression result = apply(rule, subtract(x, sin(x)));
        assertEquals(ExpressionType.OPERATOR_MINUS, result.getExpressionType());
        assertEquals(subtract(divide(pow(x, 2), constant(2)), negate(cos(x))), result);

        // never a partial result
        assertNull(apply(rule, add(x, multiply(sin(x), cos(x)))));
        assertNull(apply(rule, add(multiply(sin(x), cos(x)), x)));
        assertNull(apply(rule, multiply(x, x)));
    }

    public void testIntegrationByParts() {
        IntegrationByPartsStrategy rule = new IntegrationByPartsStrategy();
        assertEquals(subtract(multiply(x, exp(x)), exp(x)), apply(rule, multiply(x, exp(x))));
        assertEquals(subtract(multiply(x, negate(cos(x))), negate(sin(x))), apply(rule, multiply(sin(x), x)));

        AbstractExpression squared = apply(rule, multiply(pow(x, 2), sin(x)));
        assertNotNull(squared);
        assertEquals(ExpressionType.OPERATOR_MINUS, squared.getExpressionType());
        assertEquals(multiply(pow(x, 2), negate(cos(x))), squared.getLeft());

        // tan has no antiderivative here
        assertNull(apply(rule, multiply(x, tan(x))));
        // fractional powers are not taken as u
        assertNull(apply(rule, multiply(pow(x, 0.5), sin(x))));
        assertNull(apply(rule, multiply(x, ln(x))));
        assertNull(apply(rule, multiply(sin(x), cos(x))));
    }

    public void testSubstitution() {
        SubstitutionStrategy rule = (SubstitutionStrategy) StrategyKind.SUBSTITUTION.create(
                CalculusConfig.builder().build());
        assertEquals(negate(cos(pow(x, 2))), apply(rule, multiply(multiply(constant(2), x), sin(pow(x, 2)))));
        assertEquals(multiply(constant(0.5), sin(pow(x, 2))), apply(rule, multiply(x, cos(pow(x, 2)))));
        assertEquals(multiply(constant(1.5), exp(pow(x, 2))), apply(rule, multiply(exp(pow(x, 2)), multiply(constant(3), x))));
        // the function need not be the first factor
        assertEquals(exp(sin(x)), apply(rule, multiply(cos(x), exp(sin(x)))));

        assertNull(apply(rule, multiply(x, sin(x))));
        assertNull(apply(rule, multiply(sin(x), cos(x))));
        assertNull(apply(rule, sin(pow(x, 2))));
        assertNull(apply(rule, multiply(y, sin(pow(x, 2)))));
    }
}
