/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.awaitlift.ast;

import org.awaitlift.Token;

/** If-statement with an optional else part. Node type is {@link Token#IF}. */
public class IfStatement extends Statement {

    private Expression condition;
    private Statement then;
    private Statement otherwise;

    {
        type = Token.IF;
    }

    /** @param otherwise the else part, {@code null} if there is none */
    public IfStatement(Expression condition, Statement then, Statement otherwise) {
        setCondition(condition);
        setThen(then);
        setOtherwise(otherwise);
    }

    public Expression getCondition() {
        return condition;
    }

    public void setCondition(Expression condition) {
        assertNotNull(condition);
        this.condition = condition;
        condition.setParent(this);
    }

    public Statement getThen() {
        return then;
    }

    public void setThen(Statement then) {
        assertNotNull(then);
        this.then = then;
        then.setParent(this);
    }

    /** Returns the else part, {@code null} if none */
    public Statement getOtherwise() {
        return otherwise;
    }

    public void setOtherwise(Statement otherwise) {
        this.otherwise = otherwise;
        if (otherwise != null) otherwise.setParent(this);
    }

    @Override
    public String toSource(int depth) {
        StringBuilder sb = new StringBuilder();
        sb.append(makeIndent(depth)).append("if (").append(condition.toSource(0)).append(") ");
        sb.append(then.toSource(0));
        if (otherwise != null) {
            sb.append(" else ").append(otherwise.toSource(0));
        }
        return sb.toString();
    }

    /** Visits this node, the condition, the then-part, and if supplied, the else-part. */
    @Override
    public void visit(NodeVisitor v) {
        if (v.visit(this)) {
            condition.visit(v);
            then.visit(v);
            if (otherwise != null) {
                otherwise.visit(v);
            }
        }
    }
}
