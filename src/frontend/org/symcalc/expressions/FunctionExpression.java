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
import org.symcalc.types.FunctionType;

import com.google.common.base.Preconditions;

/**
 * Application of a named unary function to an operand. The operand is
 * kept as the left child.
 */
public class FunctionExpression extends AbstractExpression {

    private final FunctionType m_function;

    public FunctionExpression(FunctionType function, AbstractExpression operand) {
        super(ExpressionType.FUNCTION, Preconditions.checkNotNull(operand), null);
        m_function = Preconditions.checkNotNull(function);
    }

    @Override
    public void validate() {
        super.validate();

        if (m_right != null) {
            throw new ValidationError("Function '%s' takes exactly one argument", m_function.getName());
        }
    }

    public FunctionType getFunction() {
        return m_function;
    }

    public boolean isFunction(FunctionType function) {
        return m_function == function;
    }

    public AbstractExpression getOperand() {
        return m_left;
    }

    @Override
    public double evaluate(Map<String, Double> bindings) {
        return m_function.apply(m_left.evaluate(bindings));
    }

    @Override
    public AbstractExpression simplify() {
        AbstractExpression operand = m_left.simplify();
        if (operand == m_left) {
            return this;
        }
        return new FunctionExpression(m_function, operand);
    }

    @Override
    public String explain() {
        return m_function.getName() + "(" + m_left.explain() + ")";
    }

    @Override
    protected String getExpressionNodeNameForToString() {
        return "FunctionExpression[" + m_function.getName() + "]";
    }

    @Override
    protected boolean hasEqualAttributes(AbstractExpression obj) {
        if (! (obj instanceof FunctionExpression)) {
            return false;
        }
        return m_function == ((FunctionExpression) obj).m_function;
    }

    @Override
    public int hashCode() {
        return super.hashCode() + m_function.hashCode();
    }
}
