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

import org.symcalc.exceptions.EvaluationException;
import org.symcalc.exceptions.ValidationError;
import org.symcalc.types.ExpressionType;

import com.google.common.collect.ImmutableSet;

/**
 * A named free variable. Two variables are the same variable iff they
 * have the same name.
 */
public class VariableExpression extends AbstractValueExpression {

    private final String m_name;

    public VariableExpression(String name) {
        super(ExpressionType.VALUE_VARIABLE);
        m_name = name;
    }

    @Override
    public void validate() {
        super.validate();

        if (m_name == null || m_name.isEmpty()) {
            throw new ValidationError("A variable must have a name");
        }
    }

    public String getName() {
        return m_name;
    }

    @Override
    public double evaluate(Map<String, Double> bindings) {
        Double value = bindings.get(m_name);
        if (value == null) {
            throw new EvaluationException("No value bound to variable '%s'", m_name);
        }
        return value;
    }

    @Override
    protected void collectVariableTerms(ImmutableSet.Builder<VariableExpression> builder) {
        builder.add(this);
    }

    @Override
    public String explain() {
        return m_name;
    }

    @Override
    protected String getExpressionNodeNameForToString() {
        return "VariableExpression[" + m_name + "]";
    }

    @Override
    public boolean equals(Object obj) {
        if (! (obj instanceof VariableExpression)) {
            return false;
        }
        return m_name.equals(((VariableExpression) obj).m_name);
    }

    @Override
    public int hashCode() {
        return m_name.hashCode();
    }
}
