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

package org.symcalc.integration;

import org.symcalc.expressions.AbstractExpression;
import org.symcalc.expressions.VariableExpression;

/**
 * One symbolic integration technique. Implementations are stateless and
 * may be shared between threads.
 */
public interface IntegrationStrategy {

    /**
     * Attempt to integrate an expression.
     *
     * @param expr the integrand
     * @param variable the variable of integration
     * @param pipeline the pipeline to use for integrating sub-expressions
     * @return an antiderivative, without constant of integration, or null
     *         if this strategy does not apply
     */
    AbstractExpression tryIntegrate(AbstractExpression expr, VariableExpression variable, SymbolicIntegration pipeline);

    /**
     * @return a short human readable name, for logging
     */
    String getName();
}
