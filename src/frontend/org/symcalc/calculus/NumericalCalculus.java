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

import java.util.function.DoubleUnaryOperator;

import com.google.common.base.Preconditions;

/**
 * Finite difference and quadrature over plain double functions.
 */
public final class NumericalCalculus {

    private NumericalCalculus() {}

    /**
     * Central difference, (f(x+h) - f(x-h)) / 2h.
     */
    public static double derivative(DoubleUnaryOperator f, double x, double h) {
        Preconditions.checkArgument(h > 0, "step must be positive, got %s", h);
        return (f.applyAsDouble(x + h) - f.applyAsDouble(x - h)) / (2 * h);
    }

    /**
     * Composite Simpson's rule over [a, b]. An odd interval count is
     * rounded up to the next even one. Reversed bounds give the negated
     * integral.
     */
    public static double simpson(DoubleUnaryOperator f, double a, double b, int intervals) {
        Preconditions.checkArgument(intervals > 0, "interval count must be positive, got %s", intervals);
        if (a == b) {
            return 0.0;
        }
        int n = (intervals % 2 == 0) ? intervals : intervals + 1;
        double h = (b - a) / n;
        double sum = f.applyAsDouble(a) + f.applyAsDouble(b);
        for (int ii = 1; ii < n; ii++) {
            sum += ((ii % 2 == 0) ? 2 : 4) * f.applyAsDouble(a + ii * h);
        }
        return sum * h / 3;
    }
}
