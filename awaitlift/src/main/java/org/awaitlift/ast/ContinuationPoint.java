/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.awaitlift.ast;

import org.awaitlift.Token;

/**
 * A suspend boundary in a lowered body: the expression is evaluated, then execution suspends and
 * later resumes at the next statement. The lowering produces these; they never appear in its
 * input. Node type is {@link Token#CONTINUATION_POINT}.
 */
public class ContinuationPoint extends Statement {

    private Expression expression;

    {
        type = Token.CONTINUATION_POINT;
    }

    public ContinuationPoint(Expression expression) {
        setExpression(expression);
    }

    public Expression getExpression() {
        return expression;
    }

    public void setExpression(Expression expression) {
        assertNotNull(expression);
        this.expression = expression;
        expression.setParent(this);
    }

    @Override
    public String toSource(int depth) {
        return makeIndent(depth) + "[yield] " + expression.toSource(0) + ";";
    }

    @Override
    public void visit(NodeVisitor v) {
        if (v.visit(this)) {
            expression.visit(v);
        }
    }
}
