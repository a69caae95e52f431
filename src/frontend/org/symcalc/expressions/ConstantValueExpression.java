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

/**
 * A numeric literal.
 */
public class ConstantValueExpression extends AbstractValueExpression {

    public static final ConstantValueExpression ZERO = new ConstantValueExpression(0);
    public static final ConstantValueExpression ONE = new ConstantValueExpression(1);

    private final double m_value;

    public ConstantValueExpression(double value) {
        super(ExpressionType.VALUE_CONSTANT);
        // adding positive zero turns -0.0 into 0.0 so the two compare equal
        m_value = value + 0.0;
    }

    @Override
    public void validate() {
        super.validate();

        if (Double.isNaN(m_value)) {
            throw new ValidationError("The constant value for '%s' is not a number", explain());
        }
    }

    public double getValue() {
        return m_value;
    }

    /**
     * @return true if the literal holds exactly this value
     */
    public boolean hasValue(double value) {
        return m_value == value;
    }

    public boolean isIntegral() {
        return !Double.isInfinite(m_value) && m_value == Math.rint(m_value);
    }

    @Override
    public double evaluate(Map<String, Double> bindings) {
        return m_value;
    }

    @Override
    public String explain() {
        if (isIntegral() && Math.abs(m_value) < 1e15) {
            return Long.toString((long) m_value);
        }
        return Double.toString(m_value);
    }

    @Override
    public boolean equals(Object obj) {
        if (! (obj instanceof ConstantValueExpression)) {
            return false;
        }
        return Double.compare(m_value, ((ConstantValueExpression) obj).m_value) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(m_value);
    }
}
