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

import static org.symcalc.expressions.ExpressionUtil.isConstant;
import static org.symcalc.expressions.ExpressionUtil.multiply;
import static org.symcalc.expressions.ExpressionUtil.negate;

import org.symcalc.expressions.AbstractExpression;
import org.symcalc.expressions.VariableExpression;
import org.symcalc.types.ExpressionType;

/**
 * Pulls a factor free of the variable, or a negation, out of the integral.
 */
public class ConstantMultipleStrategy implements IntegrationStrategy {

    @Override
    public AbstractExpression tryIntegrate(AbstractExpression expr, VariableExpression variable, SymbolicIntegration pipeline) {
        ExpressionType type = expr.getExpressionType();
        if (type == ExpressionType.OPERATOR_UNARY_MINUS) {
            AbstractExpression integral = pipeline.tryIntegrate(expr.getLeft(), variable);
            return integral == null ? null : negate(integral);
        }
        if (type != ExpressionType.OPERATOR_MULTIPLY) {
            return null;
        }

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

    @Override
    public String getName() {
        return "Constant Multiple";
    }
}
