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

import static org.symcalc.expressions.ExpressionUtil.add;
import static org.symcalc.expressions.ExpressionUtil.conditional;
import static org.symcalc.expressions.ExpressionUtil.constant;
import static org.symcalc.expressions.ExpressionUtil.cos;
import static org.symcalc.expressions.ExpressionUtil.cot;
import static org.symcalc.expressions.ExpressionUtil.csc;
import static org.symcalc.expressions.ExpressionUtil.divide;
import static org.symcalc.expressions.ExpressionUtil.exp;
import static org.symcalc.expressions.ExpressionUtil.ln;
import static org.symcalc.expressions.ExpressionUtil.multiply;
import static org.symcalc.expressions.ExpressionUtil.negate;
import static org.symcalc.expressions.ExpressionUtil.pow;
import static org.symcalc.expressions.ExpressionUtil.sec;
import static org.symcalc.expressions.ExpressionUtil.sin;
import static org.symcalc.expressions.ExpressionUtil.sqrt;
import static org.symcalc.expressions.ExpressionUtil.subtract;
import static org.symcalc.expressions.ExpressionUtil.tan;

import java.util.EnumMap;
import java.util.Map;
import java.util.function.UnaryOperator;

import org.symcalc.exceptions.ValidationError;
import org.symcalc.expressions.AbstractExpression;
import org.symcalc.expressions.ConstantValueExpression;
import org.symcalc.expressions.FunctionExpression;
import org.symcalc.expressions.OperatorExpression;
import org.symcalc.expressions.VariableExpression;
import org.symcalc.types.ExpressionType;
import org.symcalc.types.FunctionType;

import com.google.common.base.Preconditions;

/**
 * Symbolic partial differentiation by structural recursion, one rule per
 * node shape. Every symbol other than the differentiation variable is held
 * constant. Results are not simplified; call {@link AbstractExpression#simplify()}
 * on them when a tidy form is wanted.
 *
 * Differentiation is total: any well formed tree has a derivative, so this
 * class never throws for a tree that passes {@link AbstractExpression#validate()}.
 */
public final class Differentiator {

    /// Derivative of each named function with respect to its own operand u.
    /// The chain rule factor u' is applied by the caller.
    private static final Map<FunctionType, UnaryOperator<AbstractExpression>> s_derivativeTable =
            new EnumMap<>(FunctionType.class);
    static {
        s_derivativeTable.put(FunctionType.SIN, u -> cos(u));
        s_derivativeTable.put(FunctionType.COS, u -> negate(sin(u)));
        s_derivativeTable.put(FunctionType.TAN, u -> pow(sec(u), 2));
        s_derivativeTable.put(FunctionType.SEC, u -> multiply(sec(u), tan(u)));
        s_derivativeTable.put(FunctionType.CSC, u -> negate(multiply(csc(u), cot(u))));
        s_derivativeTable.put(FunctionType.COT, u -> negate(pow(csc(u), 2)));
        s_derivativeTable.put(FunctionType.EXP, u -> exp(u));
        s_derivativeTable.put(FunctionType.LN, u -> divide(ConstantValueExpression.ONE, u));
        s_derivativeTable.put(FunctionType.ASIN,
                u -> divide(ConstantValueExpression.ONE, sqrt(subtract(ConstantValueExpression.ONE, pow(u, 2)))));
        s_derivativeTable.put(FunctionType.ACOS,
                u -> negate(divide(ConstantValueExpression.ONE, sqrt(subtract(ConstantValueExpression.ONE, pow(u, 2))))));
        s_derivativeTable.put(FunctionType.ATAN,
                u -> divide(ConstantValueExpression.ONE, add(ConstantValueExpression.ONE, pow(u, 2))));
        s_derivativeTable.put(FunctionType.SQRT,
                u -> divide(ConstantValueExpression.ONE, multiply(constant(2), sqrt(u))));
        assert(s_derivativeTable.size() == FunctionType.values().length);
    }

    private Differentiator() {}

    public static AbstractExpression differentiate(AbstractExpression expr, String variable) {
        return differentiate(expr, new VariableExpression(variable));
    }

    public static AbstractExpression differentiate(AbstractExpression expr, VariableExpression variable) {
        Preconditions.checkNotNull(expr, "cannot differentiate a null expression");
        Preconditions.checkNotNull(variable, "differentiation variable is null");

        ExpressionType type = expr.getExpressionType();
        switch (type) {
            case VALUE_CONSTANT:
                return ConstantValueExpression.ZERO;

            case VALUE_VARIABLE:
                return variable.equals(expr) ? ConstantValueExpression.ONE : ConstantValueExpression.ZERO;

            case OPERATOR_PLUS:
                return add(differentiate(expr.getLeft(), variable), differentiate(expr.getRight(), variable));

            case OPERATOR_MINUS:
                return subtract(differentiate(expr.getLeft(), variable), differentiate(expr.getRight(), variable));

            case OPERATOR_MULTIPLY: {
                // (f*g)' = f'*g + f*g'
                AbstractExpression f = expr.getLeft();
                AbstractExpression g = expr.getRight();
                return add(multiply(differentiate(f, variable), g),
                           multiply(f, differentiate(g, variable)));
            }

            case OPERATOR_DIVIDE: {
                // (f/g)' = (f'*g - f*g') / (g*g)
                AbstractExpression f = expr.getLeft();
                AbstractExpression g = expr.getRight();
                return divide(subtract(multiply(differentiate(f, variable), g),
                                       multiply(f, differentiate(g, variable))),
                              multiply(g, g));
            }

            case OPERATOR_POWER:
                return differentiatePower(expr, variable);

            case OPERATOR_UNARY_MINUS:
                return negate(differentiate(expr.getLeft(), variable));

            case FUNCTION: {
                FunctionExpression fn = (FunctionExpression) expr;
                AbstractExpression u = fn.getOperand();
                AbstractExpression outer = s_derivativeTable.get(fn.getFunction()).apply(u);
                return multiply(outer, differentiate(u, variable));
            }

            case OPERATOR_CASE_WHEN: {
                // the condition is left as is, each branch is differentiated
                OperatorExpression caseWhen = (OperatorExpression) expr;
                return conditional(caseWhen.getCondition(),
                                   differentiate(caseWhen.getWhenTrue(), variable),
                                   differentiate(caseWhen.getWhenFalse(), variable));
            }

            case COMPARE_EQUAL:
            case COMPARE_NOTEQUAL:
            case COMPARE_LESSTHAN:
            case COMPARE_GREATERTHAN:
            case COMPARE_LESSTHANOREQUALTO:
            case COMPARE_GREATERTHANOREQUALTO:
                // an indicator is piecewise constant
                return ConstantValueExpression.ZERO;

            default:
                assert false : type;
                throw new ValidationError("No differentiation rule for expression type %s in '%s'",
                                          type, expr.explain());
        }
    }

    private static AbstractExpression differentiatePower(AbstractExpression expr, VariableExpression variable) {
        AbstractExpression base = expr.getLeft();
        AbstractExpression exponent = expr.getRight();
        boolean baseVaries = base.containsVariable(variable);
        boolean exponentVaries = exponent.containsVariable(variable);

        if (!exponentVaries) {
            // (f^n)' = n * f^(n-1) * f'
            AbstractExpression reduced;
            if (exponent instanceof ConstantValueExpression) {
                reduced = constant(((ConstantValueExpression) exponent).getValue() - 1);
            }
            else {
                reduced = subtract(exponent, ConstantValueExpression.ONE);
            }
            return multiply(multiply(exponent, pow(base, reduced)), differentiate(base, variable));
        }

        if (!baseVaries) {
            // (a^u)' = a^u * ln(a) * u'
            return multiply(expr, multiply(ln(base), differentiate(exponent, variable)));
        }

        // both vary, logarithmic differentiation: (f^g)' = f^g * (g'*ln(f) + g*f'/f)
        return multiply(expr,
                        add(multiply(differentiate(exponent, variable), ln(base)),
                            divide(multiply(exponent, differentiate(base, variable)), base)));
    }

    /**
     * Differentiate n times, simplifying between steps so the tree does
     * not grow with every application of the product rule.
     */
    public static AbstractExpression nthDerivative(AbstractExpression expr, VariableExpression variable, int n) {
        Preconditions.checkArgument(n >= 0, "derivative order must be non-negative, got %s", n);
        AbstractExpression result = expr;
        for (int ii = 0; ii < n; ii++) {
            result = differentiate(result, variable).simplify();
        }
        return result;
    }
}
