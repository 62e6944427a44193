/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.awaitlift.ast;

import org.awaitlift.Token;
import org.awaitlift.types.StaticType;

/**
 * Instance method call, {@code receiver.name(arguments)}. Operators are method invocations too,
 * with the operator as the name. Node type is {@link Token#METHOD_INVOCATION}.
 */
public class MethodInvocation extends InvocationExpression {

    private Expression receiver;
    private final String name;

    {
        type = Token.METHOD_INVOCATION;
    }

    public MethodInvocation(
            Expression receiver, String name, Arguments arguments, StaticType resultType) {
        super(arguments, resultType);
        assertNotNull(name);
        setReceiver(receiver);
        this.name = name;
    }

    public Expression getReceiver() {
        return receiver;
    }

    public void setReceiver(Expression receiver) {
        assertNotNull(receiver);
        this.receiver = receiver;
        receiver.setParent(this);
    }

    public String getName() {
        return name;
    }

    @Override
    public String toSource(int depth) {
        return receiver.toSource(0) + "." + name + getArguments().toSource(0);
    }

    /** Visits this node, the receiver, and the arguments. */
    @Override
    public void visit(NodeVisitor v) {
        if (v.visit(this)) {
            receiver.visit(v);
            getArguments().visit(v);
        }
    }
}
