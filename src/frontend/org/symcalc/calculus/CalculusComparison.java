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

package org.symcalc.calculus;

import com.google.common.base.MoreObjects;

/**
 * Symbolic and numerical values of a derivative at a point and of a
 * definite integral, side by side.
 */
public class CalculusComparison {
    private final double m_symbolicDerivative;
    private final double m_numericalDerivative;
    private final double m_symbolicIntegral;
    private final double m_numericalIntegral;

    public CalculusComparison(double symbolicDerivative, double numericalDerivative,
                              double symbolicIntegral, double numericalIntegral) {
        m_symbolicDerivative = symbolicDerivative;
        m_numericalDerivative = numericalDerivative;
        m_symbolicIntegral = symbolicIntegral;
        m_numericalIntegral = numericalIntegral;
    }

    public double getSymbolicDerivative() {
        return m_symbolicDerivative;
    }

    public double getNumericalDerivative() {
        return m_numericalDerivative;
    }

    public double getDerivativeError() {
        return Math.abs(m_symbolicDerivative - m_numericalDerivative);
    }

    public double getSymbolicIntegral() {
        return m_symbolicIntegral;
    }

    public double getNumericalIntegral() {
        return m_numericalIntegral;
    }

    public double getIntegralError() {
        return Math.abs(m_symbolicIntegral - m_numericalIntegral);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("symbolicDerivative", m_symbolicDerivative)
                .add("numericalDerivative", m_numericalDerivative)
                .add("derivativeError", getDerivativeError())
                .add("symbolicIntegral", m_symbolicIntegral)
                .add("numericalIntegral", m_numericalIntegral)
                .add("integralError", getIntegralError())
                .toString();
    }
}
