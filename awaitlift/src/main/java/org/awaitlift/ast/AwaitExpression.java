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
 * AST node for an {@code await} expression, the only suspend point of an async body. Node type is
 * {@link Token#AWAIT}.
 *
 * <pre><i>AwaitExpression</i> :
 *   <b>await</b> UnaryExpression</pre>
 */
public class AwaitExpression extends Expression {

    private Expression operand;

    {
        type = Token.AWAIT;
    }

    public AwaitExpression(Expression operand) {
        setOperand(operand);
    }

    public AwaitExpression(int fileOffset, Expression operand) {
        this(operand);
        setFileOffset(fileOffset);
    }

    /** Returns awaited expression */
    public Expression getOperand() {
        return operand;
    }

    /**
     * Sets awaited expression, and sets its parent to this node.
     *
     * @throws IllegalArgumentException if {@code operand} is {@code null}
     */
    public void setOperand(Expression operand) {
        assertNotNull(operand);
        this.operand = operand;
        operand.setParent(this);
    }

    /** Returns the flattened operand type: awaiting a {@code Future<T>} produces a {@code T}. */
    @Override
    public StaticType getStaticType(StaticTypeContext context) {
        return context.flatten(operand.getStaticType(context));
    }

    @Override
    public String toSource(int depth) {
        return "await " + operand.toSource(0);
    }

    /** Visits this node, and the awaited value. */
    @Override
    public void visit(NodeVisitor v) {
        if (v.visit(this)) {
            operand.visit(v);
        }
    }
}
