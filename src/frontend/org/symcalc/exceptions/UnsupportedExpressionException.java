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

package org.symcalc.exceptions;

import org.symcalc.expressions.AbstractExpression;
import org.symcalc.expressions.VariableExpression;

/**
 * Thrown when no integration strategy could find an antiderivative.
 * Callers that can live with an approximation should fall back to a
 * numeric method; the engine never substitutes a default result.
 */
public class UnsupportedExpressionException extends SymbolicErrorException {
    private static final long serialVersionUID = 1L;

    private final transient AbstractExpression m_expression;
    private final transient VariableExpression m_variable;

    public UnsupportedExpressionException(AbstractExpression expression, VariableExpression variable) {
        super("Cannot symbolically integrate %s with respect to %s", expression, variable);
        m_expression = expression;
        m_variable = variable;
    }

    public AbstractExpression getExpression() {
        return m_expression;
    }

    public VariableExpression getVariable() {
        return m_variable;
    }
}
