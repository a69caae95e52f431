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
 * Smart constructors behind {@link AbstractExpression#simplify()}. Each one
 * takes operands that are already simplified and applies the identities
 * local to one operator. Products are normalized so that a literal
 * coefficient comes first and negations sit outside the product, which is
 * the shape the integration strategies look for.
 */
final class ExpressionSimplifier {

    private ExpressionSimplifier() {}

    static AbstractExpression simplifyOperator(ExpressionType type,
                                               AbstractExpression left,
                                               AbstractExpression right) {
        switch (type) {
            case OPERATOR_PLUS:
                return simplifyAdd(left, right);
            case OPERATOR_MINUS:
                return simplifySubtract(left, right);
            case OPERATOR_MULTIPLY:
                return simplifyMultiply(left, right);
            case OPERATOR_DIVIDE:
                return simplifyDivide(left, right);
            case OPERATOR_POWER:
                return simplifyPower(left, right);
            case OPERATOR_UNARY_MINUS:
                return simplifyNegate(left);
            case OPERATOR_CASE_WHEN:
                if (left instanceof ConstantValueExpression) {
                    return isZero(left) ? right.getRight() : right.getLeft();
                }
                return new OperatorExpression(type, left, right);
            default:
                return new OperatorExpression(type, left, right);
        }
    }

    static AbstractExpression simplifyAdd(AbstractExpression left, AbstractExpression right) {
        if (isLiteral(left) && isLiteral(right)) {
            return literal(value(left) + value(right));
        }
        if (isZero(left)) {
            return right;
        }
        if (isZero(right)) {
            return left;
        }
        if (right.getExpressionType() == ExpressionType.OPERATOR_UNARY_MINUS) {
            return simplifySubtract(left, right.getLeft());
        }
        return new OperatorExpression(ExpressionType.OPERATOR_PLUS, left, right);
    }

    static AbstractExpression simplifySubtract(AbstractExpression left, AbstractExpression right) {
        if (isLiteral(left) && isLiteral(right)) {
            return literal(value(left) - value(right));
        }
        if (isZero(right)) {
            return left;
        }
        if (isZero(left)) {
            return simplifyNegate(right);
        }
        if (left.equals(right)) {
            return ConstantValueExpression.ZERO;
        }
        if (right.getExpressionType() == ExpressionType.OPERATOR_UNARY_MINUS) {
            return simplifyAdd(left, right.getLeft());
        }
        return new OperatorExpression(ExpressionType.OPERATOR_MINUS, left, right);
    }

    static AbstractExpression simplifyNegate(AbstractExpression operand) {
        if (isLiteral(operand)) {
            return literal(0.0 - value(operand));
        }
        if (operand.getExpressionType() == ExpressionType.OPERATOR_UNARY_MINUS) {
            return operand.getLeft();
        }
        return new OperatorExpression(ExpressionType.OPERATOR_UNARY_MINUS, operand, null);
    }

    static AbstractExpression simplifyMultiply(AbstractExpression left, AbstractExpression right) {
        if (isLiteral(left) && isLiteral(right)) {
            return literal(value(left) * value(right));
        }
        if (isZero(left) || isZero(right)) {
            return ConstantValueExpression.ZERO;
        }
        if (isOne(left)) {
            return right;
        }
        if (isOne(right)) {
            return left;
        }
        // literal coefficients go first
        if (isLiteral(right)) {
            return simplifyMultiply(right, left);
        }
        if (left.getExpressionType() == ExpressionType.OPERATOR_UNARY_MINUS) {
            return simplifyNegate(simplifyMultiply(left.getLeft(), right));
        }
        if (right.getExpressionType() == ExpressionType.OPERATOR_UNARY_MINUS) {
            return simplifyNegate(simplifyMultiply(left, right.getLeft()));
        }
        if (isLiteral(left)) {
            if (isProductWithCoefficient(right)) {
                return simplifyMultiply(literal(value(left) * value(right.getLeft())), right.getRight());
            }
            return new OperatorExpression(ExpressionType.OPERATOR_MULTIPLY, left, right);
        }
        if (isProductWithCoefficient(left)) {
            return simplifyMultiply(left.getLeft(), simplifyMultiply(left.getRight(), right));
        }
        if (isProductWithCoefficient(right)) {
            return simplifyMultiply(right.getLeft(), simplifyMultiply(left, right.getRight()));
        }
        return new OperatorExpression(ExpressionType.OPERATOR_MULTIPLY, left, right);
    }

    static AbstractExpression simplifyDivide(AbstractExpression left, AbstractExpression right) {
        if (isLiteral(left) && isLiteral(right) && !isZero(right)) {
            return literal(value(left) / value(right));
        }
        if (isOne(right)) {
            return left;
        }
        if (isZero(left) && !isZero(right)) {
            return ConstantValueExpression.ZERO;
        }
        return new OperatorExpression(ExpressionType.OPERATOR_DIVIDE, left, right);
    }

    static AbstractExpression simplifyPower(AbstractExpression base, AbstractExpression exponent) {
        if (isZero(exponent)) {
            return ConstantValueExpression.ONE;
        }
        if (isOne(exponent)) {
            return base;
        }
        if (isOne(base)) {
            return ConstantValueExpression.ONE;
        }
        if (isZero(base) && isLiteral(exponent) && value(exponent) > 0) {
            return ConstantValueExpression.ZERO;
        }
        if (isLiteral(base) && isLiteral(exponent)) {
            double folded = Math.pow(value(base), value(exponent));
            if (!Double.isNaN(folded)) {
                return literal(folded);
            }
        }
        return new OperatorExpression(ExpressionType.OPERATOR_POWER, base, exponent);
    }

    private static boolean isProductWithCoefficient(AbstractExpression expr) {
        return expr.getExpressionType() == ExpressionType.OPERATOR_MULTIPLY && isLiteral(expr.getLeft());
    }

    private static boolean isLiteral(AbstractExpression expr) {
        return expr instanceof ConstantValueExpression;
    }

    private static boolean isZero(AbstractExpression expr) {
        return isLiteral(expr) && ((ConstantValueExpression) expr).hasValue(0.0);
    }

    private static boolean isOne(AbstractExpression expr) {
        return isLiteral(expr) && ((ConstantValueExpression) expr).hasValue(1.0);
    }

    private static double value(AbstractExpression expr) {
        return ((ConstantValueExpression) expr).getValue();
    }

    private static ConstantValueExpression literal(double value) {
        return new ConstantValueExpression(value);
    }
}
