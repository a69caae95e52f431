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

import java.util.function.DoubleUnaryOperator;

/**
 * The named unary functions an expression tree may apply. Each one knows
 * how to compute its value; differentiation rules live with the
 * differentiator, antiderivatives with the integration strategies.
 */
public enum FunctionType {
    SIN  ("sin",  Math::sin),
    COS  ("cos",  Math::cos),
    TAN  ("tan",  Math::tan),
    SEC  ("sec",  x -> 1.0 / Math.cos(x)),
    CSC  ("csc",  x -> 1.0 / Math.sin(x)),
    COT  ("cot",  x -> 1.0 / Math.tan(x)),
    EXP  ("exp",  Math::exp),
    LN   ("ln",   Math::log),
    ASIN ("asin", Math::asin),
    ACOS ("acos", Math::acos),
    ATAN ("atan", Math::atan),
    SQRT ("sqrt", Math::sqrt);

    private final String m_name;
    private final DoubleUnaryOperator m_impl;

    FunctionType(String name, DoubleUnaryOperator impl) {
        m_name = name;
        m_impl = impl;
    }

    /**
     * @return the lower case name used when rendering a call
     */
    public String getName() {
        return m_name;
    }

    /**
     * Domain errors are not checked: ln of a negative number is NaN, the
     * way the underlying java.lang.Math call reports it.
     */
    public double apply(double operand) {
        return m_impl.applyAsDouble(operand);
    }

    public boolean isTrigonometric() {
        return this == SIN || this == COS || this == TAN;
    }
}
