/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.awaitlift.ast;

import org.awaitlift.Token;
import org.awaitlift.types.StaticType;
import org.awaitlift.types.StaticTypeContext;

/**
 * AST node for the ternary operator {@code condition ? then : otherwise}. Node type is {@link
 * Token#CONDITIONAL}.
 */
public class ConditionalExpression extends Expression {

    private Expression condition;
    private Expression then;
    private Expression otherwise;
    private final StaticType staticType;

    {
        type = Token.CONDITIONAL;
    }

    public ConditionalExpression(
            Expression condition, Expression then, Expression otherwise, StaticType staticType) {
        assertNotNull(staticType);
        setCondition(condition);
        setThen(then);
        setOtherwise(otherwise);
        this.staticType = staticType;
    }

    public Expression getCondition() {
        return condition;
    }

    public void setCondition(Expression condition) {
        assertNotNull(condition);
        this.condition = condition;
        condition.setParent(this);
    }

    public Expression getThen() {
        return then;
    }

    public void setThen(Expression then) {
        assertNotNull(then);
        this.then = then;
        then.setParent(this);
    }

    public Expression getOtherwise() {
        return otherwise;
    }

    public void setOtherwise(Expression otherwise) {
        assertNotNull(otherwise);
        this.otherwise = otherwise;
        otherwise.setParent(this);
    }

    @Override
    public StaticType getStaticType(StaticTypeContext context) {
        return staticType;
    }

    @Override
    public String toSource(int depth) {
        return condition.toSource(0) + " ? " + then.toSource(0) + " : " + otherwise.toSource(0);
    }

    /** Visits this node, then the condition, the then-expression, and the otherwise-expression. */
    @Override
    public void visit(NodeVisitor v) {
        if (v.visit(this)) {
            condition.visit(v);
            then.visit(v);
            otherwise.visit(v);
        }
    }
}
