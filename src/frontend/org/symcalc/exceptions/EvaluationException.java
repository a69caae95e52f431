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

/**
 * An expression could not be reduced to a number, typically because it
 * references a variable that has no binding.
 */
public class EvaluationException extends SymbolicErrorException {
    private static final long serialVersionUID = 1L;

    public EvaluationException(String msg) {
        super(msg);
    }
    public EvaluationException(String format, Object... args) {
        super(format, args);
    }
}
