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

import static org.symcalc.expressions.ExpressionUtil.cos;
import static org.symcalc.expressions.ExpressionUtil.cot;
import static org.symcalc.expressions.ExpressionUtil.csc;
import static org.symcalc.expressions.ExpressionUtil.isFunction;
import static org.symcalc.expressions.ExpressionUtil.isLiteral;
import static org.symcalc.expressions.ExpressionUtil.isVariable;
import static org.symcalc.expressions.ExpressionUtil.negate;
import static org.symcalc.expressions.ExpressionUtil.sec;
import static org.symcalc.expressions.ExpressionUtil.sin;
import static org.symcalc.expressions.ExpressionUtil.tan;

import org.symcalc.expressions.AbstractExpression;
import org.symcalc.expressions.FunctionExpression;
import org.symcalc.expressions.VariableExpression;
import org.symcalc.types.FunctionType;

/**
 * Table integrals of trigonometric functions whose argument is the bare
 * variable. Anything with an inner function is left to substitution.
 */
public class BasicTrigStrategy implements IntegrationStrategy {

    @Override
    public AbstractExpression tryIntegrate(AbstractExpression expr, VariableExpression variable, SymbolicIntegration pipeline) {
        switch (expr.getExpressionType()) {
            case FUNCTION:
                if (isApplied(expr, FunctionType.SIN, variable)) {
                    return negate(cos(variable));
                }
                if (isApplied(expr, FunctionType.COS, variable)) {
                    return sin(variable);
                }
                return null;

            case OPERATOR_POWER:
                if (!isLiteral(expr.getRight(), 2.0)) {
                    return null;
                }
                if (isApplied(expr.getLeft(), FunctionType.SEC, variable)) {
                    return tan(variable);
                }
                if (isApplied(expr.getLeft(), FunctionType.CSC, variable)) {
                    return negate(cot(variable));
                }
                return null;

            case OPERATOR_MULTIPLY:
                if (isPair(expr, FunctionType.SEC, FunctionType.TAN, variable)) {
                    return sec(variable);
                }
                if (isPair(expr, FunctionType.CSC, FunctionType.COT, variable)) {
                    return negate(csc(variable));
                }
                return null;

            default:
                return null;
        }
    }

    private static boolean isApplied(AbstractExpression expr, FunctionType function, VariableExpression variable) {
        return isFunction(expr, function) && isVariable(((FunctionExpression) expr).getOperand(), variable);
    }

    // either factor order
    private static boolean isPair(AbstractExpression expr, FunctionType first, FunctionType second,
                                  VariableExpression variable) {
        AbstractExpression left = expr.getLeft();
        AbstractExpression right = expr.getRight();
        return (isApplied(left, first, variable) && isApplied(right, second, variable))
                || (isApplied(left, second, variable) && isApplied(right, first, variable));
    }

    @Override
    public String getName() {
        return "Basic Trigonometric";
    }
}
