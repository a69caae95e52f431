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

import static org.symcalc.expressions.ExpressionUtil.constant;
import static org.symcalc.expressions.ExpressionUtil.divide;
import static org.symcalc.expressions.ExpressionUtil.isConstant;
import static org.symcalc.expressions.ExpressionUtil.isLiteral;
import static org.symcalc.expressions.ExpressionUtil.isPowerOf;
import static org.symcalc.expressions.ExpressionUtil.isVariable;
import static org.symcalc.expressions.ExpressionUtil.ln;
import static org.symcalc.expressions.ExpressionUtil.multiply;
import static org.symcalc.expressions.ExpressionUtil.pow;

import org.symcalc.exceptions.EvaluationException;
import org.symcalc.expressions.AbstractExpression;
import org.symcalc.expressions.ConstantValueExpression;
import org.symcalc.expressions.VariableExpression;
import org.symcalc.types.ExpressionType;

/**
 * Powers of the variable, constants, and constant multiples:
 * <ul>
 * <li>x becomes x^2/2</li>
 * <li>x^n becomes x^(n+1)/(n+1), and x^-1 becomes ln(x)</li>
 * <li>c becomes c*x</li>
 * <li>c*f and f*c become c times the integral of f</li>
 * <li>c/x becomes c*ln(x), and c/x^n is handled as c*x^-n</li>
 * </ul>
 */
public class PowerRuleStrategy implements IntegrationStrategy {

    @Override
    public AbstractExpression tryIntegrate(AbstractExpression expr, VariableExpression variable, SymbolicIntegration pipeline) {
        if (isVariable(expr, variable)) {
            return divide(pow(variable, 2), constant(2));
        }

        if (isPowerOf(expr, variable)) {
            Double exponent = constantExponent(expr.getRight(), variable);
            if (exponent != null) {
                return integratePower(variable, exponent);
            }
        }

        if (isConstant(expr, variable)) {
            return multiply(expr, variable);
        }

        ExpressionType type = expr.getExpressionType();
        if (type == ExpressionType.OPERATOR_MULTIPLY) {
            AbstractExpression left = expr.getLeft();
            AbstractExpression right = expr.getRight();
            if (isConstant(left, variable)) {
                AbstractExpression integral = pipeline.tryIntegrate(right, variable);
                if (integral != null) {
                    return multiply(left, integral);
                }
            }
            if (isConstant(right, variable)) {
                AbstractExpression integral = pipeline.tryIntegrate(left, variable);
                if (integral != null) {
                    return multiply(right, integral);
                }
            }
            return null;
        }

        if (type == ExpressionType.OPERATOR_DIVIDE && isConstant(expr.getLeft(), variable)) {
            return integrateReciprocal(expr.getLeft(), expr.getRight(), variable);
        }
        return null;
    }

    private static AbstractExpression integratePower(VariableExpression variable, double exponent) {
        if (exponent == -1.0) {
            return ln(variable);
        }
        return divide(pow(variable, exponent + 1), constant(exponent + 1));
    }

    private static AbstractExpression integrateReciprocal(AbstractExpression numerator,
                                                          AbstractExpression denominator,
                                                          VariableExpression variable) {
        if (isPowerOf(denominator, variable) && isLiteral(denominator.getRight(), 1.0)) {
            denominator = variable;
        }
        AbstractExpression integral;
        if (isVariable(denominator, variable)) {
            integral = ln(variable);
        }
        else if (isPowerOf(denominator, variable) && denominator.getRight() instanceof ConstantValueExpression) {
            integral = integratePower(variable, -((ConstantValueExpression) denominator.getRight()).getValue());
        }
        else {
            return null;
        }
        return isLiteral(numerator, 1.0) ? integral : multiply(numerator, integral);
    }

    /**
     * @return the exponent's value if it is a literal or an expression free
     *         of the variable that evaluates, otherwise null
     */
    private static Double constantExponent(AbstractExpression exponent, VariableExpression variable) {
        if (exponent instanceof ConstantValueExpression) {
            return ((ConstantValueExpression) exponent).getValue();
        }
        if (exponent.containsVariable(variable)) {
            return null;
        }
        try {
            double value = exponent.evaluate();
            return Double.isFinite(value) ? value : null;
        }
        catch (EvaluationException e) {
            // a symbolic exponent such as x^n is left to the other strategies
            return null;
        }
    }

    @Override
    public String getName() {
        return "Power Rule";
    }
}
