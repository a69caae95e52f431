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

import java.util.List;

import org.symcalc.calculus.CalculusConfig;
import org.symcalc.exceptions.UnsupportedExpressionException;
import org.symcalc.expressions.AbstractExpression;
import org.symcalc.expressions.VariableExpression;
import org.symcore.logging.SymLogger;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Symbolic integration by an ordered list of strategies. The first strategy
 * that produces a result wins; there is no backtracking, so a later strategy
 * never gets a chance to find a nicer antiderivative for a node an earlier
 * one already claimed. Strategies call back into the pipeline for
 * sub-expressions.
 *
 * The antiderivatives carry no constant of integration.
 */
public class SymbolicIntegration {
    private static final SymLogger integrationLog = new SymLogger("INTEGRATION");

    private static final SymbolicIntegration s_default =
            new SymbolicIntegration(StrategyKind.createAll(CalculusConfig.getDefault()));

    private final ImmutableList<IntegrationStrategy> m_strategies;

    public SymbolicIntegration(List<? extends IntegrationStrategy> strategies) {
        Preconditions.checkArgument(!strategies.isEmpty(), "an integration pipeline needs at least one strategy");
        m_strategies = ImmutableList.copyOf(strategies);
    }

    /**
     * @return a pipeline with every strategy, configured from config
     */
    public static SymbolicIntegration withConfig(CalculusConfig config) {
        return new SymbolicIntegration(StrategyKind.createAll(config));
    }

    /**
     * @return the shared pipeline built from the default configuration
     */
    public static SymbolicIntegration getDefault() {
        return s_default;
    }

    public static AbstractExpression integrate(AbstractExpression expr, VariableExpression variable) {
        return s_default.integrateExpression(expr, variable);
    }

    public static AbstractExpression integrate(AbstractExpression expr, String variable) {
        return integrate(expr, new VariableExpression(variable));
    }

    public List<IntegrationStrategy> getStrategies() {
        return m_strategies;
    }

    /**
     * @return an antiderivative of expr
     * @throws UnsupportedExpressionException if no strategy applies
     */
    public AbstractExpression integrateExpression(AbstractExpression expr, VariableExpression variable) {
        AbstractExpression result = tryIntegrate(expr, variable);
        if (result == null) {
            integrationLog.debugFmt("No integration strategy applies to %s with respect to %s", expr, variable);
            throw new UnsupportedExpressionException(expr, variable);
        }
        return result;
    }

    /**
     * Like {@link #integrateExpression} but reports failure as null. This
     * is what strategies use for sub-expressions.
     */
    public AbstractExpression tryIntegrate(AbstractExpression expr, VariableExpression variable) {
        Preconditions.checkNotNull(expr, "cannot integrate a null expression");
        Preconditions.checkNotNull(variable, "integration variable is null");

        for (IntegrationStrategy strategy : m_strategies) {
            AbstractExpression result = strategy.tryIntegrate(expr, variable, this);
            if (result != null) {
                if (integrationLog.isTraceEnabled()) {
                    integrationLog.traceFmt("%s: %s -> %s", strategy.getName(), expr, result);
                }
                return result;
            }
        }
        return null;
    }
}
