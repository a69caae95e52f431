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

import java.util.Formatter;

/**
 * Root of the unchecked errors raised by the symbolic engine.
 */
public class SymbolicErrorException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public SymbolicErrorException(String msg) {
        super(msg);
    }

    /**
     * Formatted error msg, the same way we use String.format.
     * @param format format string
     * @param args args in the format string
     */
    public SymbolicErrorException(String format, Object... args) {
        this(new Formatter().format(format, args).toString());
    }
    public SymbolicErrorException(Throwable e) {
        super(e);
    }
    public SymbolicErrorException(String msg, Throwable e) {
       super(msg, e);
    }
}
