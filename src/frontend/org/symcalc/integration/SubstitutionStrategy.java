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

import static org.symcalc.expressions.ExpressionUtil.constant;
import static org.symcalc.expressions.ExpressionUtil.cos;
import static org.symcalc.expressions.ExpressionUtil.exp;
import static org.symcalc.expressions.ExpressionUtil.flattenMultiply;
import static org.symcalc.expressions.ExpressionUtil.multiply;
import static org.symcalc.expressions.ExpressionUtil.negate;
import static org.symcalc.expressions.ExpressionUtil.product;
import static org.symcalc.expressions.ExpressionUtil.sin;

import java.util.ArrayList;
import java.util.List;

import org.symcalc.calculus.Differentiator;
import org.symcalc.expressions.AbstractExpression;
import org.symcalc.expressions.FunctionExpression;
import org.symcalc.expressions.VariableExpression;
import org.symcalc.types.ExpressionType;
import org.symcalc.types.FunctionType;

import com.google.common.base.Preconditions;

/**
 * u-substitution for f(u(x)) * k*u'(x) where f is sin, cos or exp. The
 * product is flattened, and each sin, cos or exp factor in turn is tried as
 * f(u) with the remaining factors as the candidate for k*u'.
 */
public class SubstitutionStrategy implements IntegrationStrategy {

    private final DerivativeMatcher m_matcher;

    public SubstitutionStrategy(DerivativeMatcher matcher) {
        m_matcher = Preconditions.checkNotNull(matcher);
    }

    public DerivativeMatcher getMatcher() {
        return m_matcher;
    }

    @Override
    public AbstractExpression tryIntegrate(AbstractExpression expr, VariableExpression variable, SymbolicIntegration pipeline) {
        if (expr.getExpressionType() != ExpressionType.OPERATOR_MULTIPLY) {
            return null;
        }
        List<AbstractExpression> factors = flattenMultiply(expr);
        for (int ii = 0; ii < factors.size(); ii++) {
            AbstractExpression factor = factors.get(ii);
            if (!(factor instanceof FunctionExpression)) {
                continue;
            }
            FunctionExpression outer = (FunctionExpression) factor;
            FunctionType function = outer.getFunction();
            if (function != FunctionType.SIN && function != FunctionType.COS && function != FunctionType.EXP) {
                continue;
            }

            List<AbstractExpression> rest = new ArrayList<>(factors);
            rest.remove(ii);
            AbstractExpression inner = outer.getOperand();
            Double ratio = m_matcher.constantRatio(product(rest), Differentiator.differentiate(inner, variable), variable);
            if (ratio == null) {
                continue;
            }
            AbstractExpression integral = antiderivative(function, inner);
            return ratio == 1.0 ? integral : multiply(constant(ratio), integral);
        }
        return null;
    }

    private static AbstractExpression antiderivative(FunctionType function, AbstractExpression inner) {
        switch (function) {
            case SIN:
                return negate(cos(inner));
            case COS:
                return sin(inner);
            case EXP:
                return exp(inner);
            default:
                throw new IllegalArgumentException("no substitution rule for " + function.getName());
        }
    }

    @Override
    public String getName() {
        return "Substitution";
    }
}
