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

import org.symcalc.exceptions.ValidationError;
import org.symcalc.types.ExpressionType;

import com.google.common.base.Preconditions;

/**
 * An instance of OperatorExpression is one of the following:
 *   - + (add)
 *   - - (subtract)
 *   - * (multiply)
 *   - / (divide)
 *   - ^ (power, left is the base and right the exponent)
 *   - - (unary minus, left only)
 *   - case when (left is the condition, right an alternative)
 *   - alternative (left is taken when the condition holds, right otherwise)
 */
public class OperatorExpression extends AbstractExpression {

    public OperatorExpression(ExpressionType type, AbstractExpression left, AbstractExpression right) {
        super(type, left, right);
        Preconditions.checkArgument(type.getExpressionClass() == OperatorExpression.class,
                "%s is not an operator", type);
        Preconditions.checkNotNull(left, "operator %s needs a left operand", type);
    }

    public boolean needsRightExpression() {
        return getExpressionType() != ExpressionType.OPERATOR_UNARY_MINUS;
    }

    @Override
    public void validate() {
        super.validate();

        if (needsRightExpression() && m_right == null) {
            throw new ValidationError("Operator '%s' is missing its right operand", m_type);
        }
        if (!needsRightExpression() && m_right != null) {
            throw new ValidationError("Unary operator '%s' has a right operand", m_type);
        }
        if (m_type == ExpressionType.OPERATOR_CASE_WHEN &&
                m_right.getExpressionType() != ExpressionType.OPERATOR_ALTERNATIVE) {
            throw new ValidationError("Operator '%s' needs '%s' on its right, found '%s'",
                    m_type, ExpressionType.OPERATOR_ALTERNATIVE, m_right.getExpressionType());
        }
    }

    @Override
    public double evaluate(Map<String, Double> bindings) {
        switch (m_type) {
            case OPERATOR_PLUS:
                return m_left.evaluate(bindings) + m_right.evaluate(bindings);
            case OPERATOR_MINUS:
                return m_left.evaluate(bindings) - m_right.evaluate(bindings);
            case OPERATOR_MULTIPLY:
                return m_left.evaluate(bindings) * m_right.evaluate(bindings);
            case OPERATOR_DIVIDE:
                return m_left.evaluate(bindings) / m_right.evaluate(bindings);
            case OPERATOR_POWER:
                return Math.pow(m_left.evaluate(bindings), m_right.evaluate(bindings));
            case OPERATOR_UNARY_MINUS:
                return -m_left.evaluate(bindings);
            case OPERATOR_CASE_WHEN:
                // only the chosen branch is evaluated
                if (m_left.evaluate(bindings) != 0.0) {
                    return m_right.m_left.evaluate(bindings);
                }
                return m_right.m_right.evaluate(bindings);
            default:
                throw new ValidationError("Operator '%s' cannot be evaluated on its own", m_type);
        }
    }

    @Override
    public AbstractExpression simplify() {
        AbstractExpression left = m_left.simplify();
        AbstractExpression right = (m_right == null) ? null : m_right.simplify();
        return ExpressionSimplifier.simplifyOperator(m_type, left, right);
    }

    /**
     * For a CASE WHEN node, the condition.
     */
    public AbstractExpression getCondition() {
        Preconditions.checkState(m_type == ExpressionType.OPERATOR_CASE_WHEN);
        return m_left;
    }

    /**
     * For a CASE WHEN node, the value taken when the condition holds.
     */
    public AbstractExpression getWhenTrue() {
        Preconditions.checkState(m_type == ExpressionType.OPERATOR_CASE_WHEN);
        return m_right.m_left;
    }

    /**
     * For a CASE WHEN node, the value taken otherwise.
     */
    public AbstractExpression getWhenFalse() {
        Preconditions.checkState(m_type == ExpressionType.OPERATOR_CASE_WHEN);
        return m_right.m_right;
    }

    @Override
    public String explain() {
        final String explainLeft = m_left.explain();
        switch (m_type) {
            case OPERATOR_UNARY_MINUS:
                return String.format("(-%s)", explainLeft);
            case OPERATOR_POWER:
                // a negative literal base keeps its sign inside the power
                if (m_left instanceof ConstantValueExpression
                        && ((ConstantValueExpression) m_left).getValue() < 0) {
                    return String.format("((%s)^%s)", explainLeft, m_right.explain());
                }
                return String.format("(%s^%s)", explainLeft, m_right.explain());
            case OPERATOR_CASE_WHEN:
                if (m_right == null || m_right.getExpressionType() != ExpressionType.OPERATOR_ALTERNATIVE) {
                    return String.format("(CASE WHEN %s THEN %s END)", explainLeft,
                            m_right == null ? "?" : m_right.explain());
                }
                return String.format("(CASE WHEN %s THEN %s ELSE %s END)",
                        explainLeft, m_right.m_left.explain(), m_right.m_right.explain());
            case OPERATOR_ALTERNATIVE:
                return String.format("(%s ELSE %s)", explainLeft, m_right.explain());
            default:
                return String.format("(%s %s %s)", explainLeft, m_type.symbol(), m_right.explain());
        }
    }
}
