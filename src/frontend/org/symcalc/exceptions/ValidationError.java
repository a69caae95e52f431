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
 * Validation error includes invariant violations found in an expression
 * tree, e.g. in all AbstractExpression validate methods. These are
 * programming errors, not conditions a caller is expected to recover from.
 */
public class ValidationError extends SymbolicErrorException {
    private static final long serialVersionUID = 1L;

    public ValidationError(String msg) {
        super(msg);
    }
    public ValidationError(String format, Object... args) {
        super("ValidationError: " + format, args);
    }

    @Override
    public String toString() {
        return "ValidationError: " + super.toString();
    }
}
