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

package org.symcalc.expressions;

import java.util.Map;

import org.symcalc.types.ExpressionType;

import com.google.common.base.Preconditions;

/**
 * A comparison between two numeric expressions. It evaluates to 1 when
 * the comparison holds and 0 otherwise, which is how a CASE WHEN condition
 * is tested.
 */
public class ComparisonExpression extends AbstractExpression {

    public ComparisonExpression(ExpressionType type, AbstractExpression left, AbstractExpression right) {
        super(type, Preconditions.checkNotNull(left), Preconditions.checkNotNull(right));
        Preconditions.checkArgument(type.isComparison(), "%s is not a comparison", type);
    }

    @Override
    public double evaluate(Map<String, Double> bindings) {
        double left = m_left.evaluate(bindings);
        double right = m_right.evaluate(bindings);
        boolean holds;
        switch (m_type) {
            case COMPARE_EQUAL:
                holds = left == right;
                break;
            case COMPARE_NOTEQUAL:
                holds = left != right;
                break;
            case COMPARE_LESSTHAN:
                holds = left < right;
                break;
            case COMPARE_GREATERTHAN:
                holds = left > right;
                break;
            case COMPARE_LESSTHANOREQUALTO:
                holds = left <= right;
                break;
            case COMPARE_GREATERTHANOREQUALTO:
                holds = left >= right;
                break;
            default:
                throw new AssertionError("Unrecognized comparison " + m_type);
        }
        return holds ? 1.0 : 0.0;
    }

    @Override
    public AbstractExpression simplify() {
        AbstractExpression left = m_left.simplify();
        AbstractExpression right = m_right.simplify();
        if (left instanceof ConstantValueExpression && right instanceof ConstantValueExpression) {
            return new ConstantValueExpression(new ComparisonExpression(m_type, left, right).evaluate());
        }
        return new ComparisonExpression(m_type, left, right);
    }

    @Override
    public String explain() {
        return String.format("(%s %s %s)", m_left.explain(), m_type.symbol(), m_right.explain());
    }
}
