/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.awaitlift.ast;

import org.awaitlift.Token;
import org.awaitlift.types.StaticType;

/**
 * Call of a function-typed value, {@code receiver(arguments)}. Node type is {@link
 * Token#FUNCTION_INVOCATION}.
 */
public class FunctionInvocation extends InvocationExpression {

    private Expression receiver;

    {
        type = Token.FUNCTION_INVOCATION;
    }

    public FunctionInvocation(Expression receiver, Arguments arguments, StaticType resultType) {
        super(arguments, resultType);
        setReceiver(receiver);
    }

    public Expression getReceiver() {
        return receiver;
    }

    public void setReceiver(Expression receiver) {
        assertNotNull(receiver);
        this.receiver = receiver;
        receiver.setParent(this);
    }

    @Override
    public String toSource(int depth) {
        return receiver.toSource(0) + ".call" + getArguments().toSource(0);
    }

    @Override
    public void visit(NodeVisitor v) {
        if (v.visit(this)) {
            receiver.visit(v);
            getArguments().visit(v);
        }
    }
}
