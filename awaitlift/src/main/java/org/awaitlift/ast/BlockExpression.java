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
 * A statement sequence followed by a value, {@code block { statements } => value}. Node type is
 * {@link Token#BLOCK_EXPRESSION}.
 */
public class BlockExpression extends Expression {

    private Block body;
    private Expression value;

    {
        type = Token.BLOCK_EXPRESSION;
    }

    public BlockExpression(Block body, Expression value) {
        setBody(body);
        setValue(value);
    }

    public Block getBody() {
        return body;
    }

    public void setBody(Block body) {
        assertNotNull(body);
        this.body = body;
        body.setParent(this);
    }

    public Expression getValue() {
        return value;
    }

    public void setValue(Expression value) {
        assertNotNull(value);
        this.value = value;
        value.setParent(this);
    }

    @Override
    public StaticType getStaticType(StaticTypeContext context) {
        return value.getStaticType(context);
    }

    @Override
    public String toSource(int depth) {
        return "block " + body.toSource(0) + " => " + value.toSource(0);
    }

    @Override
    public void visit(NodeVisitor v) {
        if (v.visit(this)) {
            body.visit(v);
            value.visit(v);
        }
    }
}
