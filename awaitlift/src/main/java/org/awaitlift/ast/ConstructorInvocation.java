/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.awaitlift.ast;

import org.awaitlift.Token;

/**
 * Instance creation, {@code new C(arguments)}. Node type is {@link
 * Token#CONSTRUCTOR_INVOCATION}.
 */
public class ConstructorInvocation extends InvocationExpression {

    private final Member target;

    {
        type = Token.CONSTRUCTOR_INVOCATION;
    }

    /** @param target the constructor; its type is the constructed class type */
    public ConstructorInvocation(Member target, Arguments arguments) {
        super(arguments, target.getType());
        this.target = target;
    }

    public Member getTarget() {
        return target;
    }

    @Override
    public String toSource(int depth) {
        return "new " + target.getName() + getArguments().toSource(0);
    }

    @Override
    public void visit(NodeVisitor v) {
        if (v.visit(this)) {
            getArguments().visit(v);
        }
    }
}
