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

import org.symcalc.expressions.AbstractExpression;
import org.symcalc.expressions.OperatorExpression;
import org.symcalc.expressions.VariableExpression;
import org.symcalc.types.ExpressionType;

/**
 * Linearity over + and -. Both halves must integrate; there is no partial
 * result.
 */
public class SumDifferenceStrategy implements IntegrationStrategy {

    @Override
    public AbstractExpression tryIntegrate(AbstractExpression expr, VariableExpression variable, SymbolicIntegration pipeline) {
        ExpressionType type = expr.getExpressionType();
        if (type != ExpressionType.OPERATOR_PLUS && type != ExpressionType.OPERATOR_MINUS) {
            return null;
        }
        AbstractExpression left = pipeline.tryIntegrate(expr.getLeft(), variable);
        if (left == null) {
            return null;
        }
        AbstractExpression right = pipeline.tryIntegrate(expr.getRight(), variable);
        if (right == null) {
            return null;
        }
        return new OperatorExpression(type, left, right);
    }

    @Override
    public String getName() {
        return "Sum/Difference";
    }
}
