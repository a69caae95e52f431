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

import org.symcalc.types.ExpressionType;

/**
 * Base class for Expression types that represent a value.
 * This does nothing, but makes examining expression trees easier in some ways.
 *
 */
public abstract class AbstractValueExpression extends AbstractExpression {

    public AbstractValueExpression(ExpressionType type) {
        super(type);
    }

    // Disable all the structural equality checking overhead of AbstractExpression.
    // Force AbstractValueExpression derived classes to fend for themselves.
    @Override
    public abstract boolean equals(Object obj);

    @Override
    public abstract int hashCode();

    // Leaves are already as simple as they get.
    @Override
    public AbstractExpression simplify() {
        return this;
    }
}
