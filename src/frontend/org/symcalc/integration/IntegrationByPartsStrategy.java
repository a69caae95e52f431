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

import static org.symcalc.expressions.ExpressionUtil.isFunction;
import static org.symcalc.expressions.ExpressionUtil.isPowerOf;
import static org.symcalc.expressions.ExpressionUtil.isVariable;
import static org.symcalc.expressions.ExpressionUtil.multiply;
import static org.symcalc.expressions.ExpressionUtil.subtract;

import org.symcalc.calculus.Differentiator;
import org.symcalc.expressions.AbstractExpression;
import org.symcalc.expressions.ConstantValueExpression;
import org.symcalc.expressions.VariableExpression;
import org.symcalc.types.ExpressionType;
import org.symcalc.types.FunctionType;

/**
 * Integration by parts, u*dv = u*v - integral(v*du), for a product of a
 * positive integer power of the variable with sin, cos, tan or exp. The
 * power is always taken as u, so each application lowers its degree and
 * the recursion ends.
 */
public class IntegrationByPartsStrategy implements IntegrationStrategy {

    @Override
    public AbstractExpression tryIntegrate(AbstractExpression expr, VariableExpression variable, SymbolicIntegration pipeline) {
        if (expr.getExpressionType() != ExpressionType.OPERATOR_MULTIPLY) {
            return null;
        }
        AbstractExpression left = expr.getLeft();
        AbstractExpression right = expr.getRight();
        if (isPolynomial(left, variable) && isTranscendental(right)) {
            AbstractExpression result = byParts(left, right, variable, pipeline);
            if (result != null) {
                return result;
            }
        }
        if (isPolynomial(right, variable) && isTranscendental(left)) {
            return byParts(right, left, variable, pipeline);
        }
        return null;
    }

    private static AbstractExpression byParts(AbstractExpression u,
                                              AbstractExpression dv,
                                              VariableExpression variable,
                                              SymbolicIntegration pipeline) {
        AbstractExpression du = Differentiator.differentiate(u, variable).simplify();
        AbstractExpression v = pipeline.tryIntegrate(dv, variable);
        if (v == null) {
            return null;
        }
        AbstractExpression remaining = pipeline.tryIntegrate(multiply(v, du).simplify(), variable);
        if (remaining == null) {
            return null;
        }
        return subtract(multiply(u, v), remaining);
    }

    private static boolean isPolynomial(AbstractExpression expr, VariableExpression variable) {
        if (isVariable(expr, variable)) {
            return true;
        }
        if (isPowerOf(expr, variable) && expr.getRight() instanceof ConstantValueExpression) {
            ConstantValueExpression exponent = (ConstantValueExpression) expr.getRight();
            return exponent.isIntegral() && exponent.getValue() >= 1;
        }
        return false;
    }

    private static boolean isTranscendental(AbstractExpression expr) {
        return isFunction(expr, FunctionType.SIN)
                || isFunction(expr, FunctionType.COS)
                || isFunction(expr, FunctionType.TAN)
                || isFunction(expr, FunctionType.EXP);
    }

    @Override
    public String getName() {
        return "Integration by Parts";
    }
}
