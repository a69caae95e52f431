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

import static org.symcalc.expressions.ExpressionUtil.divide;
import static org.symcalc.expressions.ExpressionUtil.exp;
import static org.symcalc.expressions.ExpressionUtil.isConstant;
import static org.symcalc.expressions.ExpressionUtil.isFunction;
import static org.symcalc.expressions.ExpressionUtil.isVariable;
import static org.symcalc.expressions.ExpressionUtil.ln;

import org.symcalc.expressions.AbstractExpression;
import org.symcalc.expressions.FunctionExpression;
import org.symcalc.expressions.VariableExpression;
import org.symcalc.types.ExpressionType;
import org.symcalc.types.FunctionType;

/**
 * exp(x) and a^x for a base free of the variable. A literal base must be
 * positive; 1^x integrates to x.
 */
public class ExponentialStrategy implements IntegrationStrategy {

    @Override
    public AbstractExpression tryIntegrate(AbstractExpression expr, VariableExpression variable, SymbolicIntegration pipeline) {
        if (isFunction(expr, FunctionType.EXP) && isVariable(((FunctionExpression) expr).getOperand(), variable)) {
            return exp(variable);
        }
        if (expr.getExpressionType() == ExpressionType.OPERATOR_POWER
                && isVariable(expr.getRight(), variable)
                && isConstant(expr.getLeft(), variable)) {
            AbstractExpression base = expr.getLeft();
            if (base.getVariableTerms().isEmpty()) {
                double value = base.evaluate();
                if (value == 1.0) {
                    return variable;
                }
                // no real ln(a) for these bases
                if (!Double.isFinite(value) || value <= 0.0) {
                    return null;
                }
            }
            return divide(expr, ln(base));
        }
        return null;
    }

    @Override
    public String getName() {
        return "Exponential";
    }
}
