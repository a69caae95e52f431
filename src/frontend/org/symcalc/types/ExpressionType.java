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

package org.symcalc.types;

import java.util.HashMap;
import java.util.Map;

import org.symcalc.expressions.AbstractExpression;
import org.symcalc.expressions.ComparisonExpression;
import org.symcalc.expressions.ConstantValueExpression;
import org.symcalc.expressions.FunctionExpression;
import org.symcalc.expressions.OperatorExpression;
import org.symcalc.expressions.VariableExpression;

/**
 * Kinds of expression tree nodes. Each kind is bound to the
 * expression class that is allowed to carry it.
 */
public enum ExpressionType {
    INVALID                      (null, 0, "<invalid>"),

    // Operators
    OPERATOR_PLUS                (OperatorExpression.class,  1, "+"),
    OPERATOR_MINUS               (OperatorExpression.class,  2, "-"),
    OPERATOR_MULTIPLY            (OperatorExpression.class,  3, "*"),
    OPERATOR_DIVIDE              (OperatorExpression.class,  4, "/"),
    OPERATOR_POWER               (OperatorExpression.class,  5, "^"),
    OPERATOR_UNARY_MINUS         (OperatorExpression.class,  6, "-"),
    OPERATOR_CASE_WHEN           (OperatorExpression.class,  7, "CASE WHEN"),
    OPERATOR_ALTERNATIVE         (OperatorExpression.class,  8, "ELSE"),

    // Comparisons
    COMPARE_EQUAL                (ComparisonExpression.class, 10, "=="),
    COMPARE_NOTEQUAL             (ComparisonExpression.class, 11, "!="),
    COMPARE_LESSTHAN             (ComparisonExpression.class, 12, "<"),
    COMPARE_GREATERTHAN          (ComparisonExpression.class, 13, ">"),
    COMPARE_LESSTHANOREQUALTO    (ComparisonExpression.class, 14, "<="),
    COMPARE_GREATERTHANOREQUALTO (ComparisonExpression.class, 15, ">="),

    // Functions
    FUNCTION                     (FunctionExpression.class,  20, ""),

    // Leaves
    VALUE_CONSTANT               (ConstantValueExpression.class, 30, ""),
    VALUE_VARIABLE               (VariableExpression.class,      31, "");

    private final int m_value;
    private final String m_symbol;
    private final Class<? extends AbstractExpression> m_expressionClass;

    ExpressionType(Class<? extends AbstractExpression> expressionClass, int val, String symbol) {
        m_value = val;
        m_symbol = symbol;
        m_expressionClass = expressionClass;
    }

    public Class<? extends AbstractExpression> getExpressionClass() {
        return m_expressionClass;
    }

    public int getValue() {
        return m_value;
    }

    public String symbol() {
        return m_symbol;
    }

    public boolean isComparison() {
        return m_expressionClass == ComparisonExpression.class;
    }

    private static final Map<Integer, ExpressionType> idx_lookup = new HashMap<>();
    static {
        for (ExpressionType vt : ExpressionType.values()) {
            idx_lookup.put(vt.m_value, vt);
        }
    }

    public static ExpressionType get(Integer idx) {
        ExpressionType ret = idx_lookup.get(idx);
        return (ret == null ? ExpressionType.INVALID : ret);
    }
}
