/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.awaitlift.ast;

import org.awaitlift.Token;

/** Call of a superclass method, {@code super.name(arguments)}. */
public class SuperMethodInvocation extends InvocationExpression {

    private final Member target;

    {
        type = Token.SUPER_METHOD_INVOCATION;
    }

    public SuperMethodInvocation(Member target, Arguments arguments) {
        super(arguments, target.getType());
        this.target = target;
    }

    public Member getTarget() {
        return target;
    }

    @Override
    public String toSource(int depth) {
        return "super." + target.getName() + getArguments().toSource(0);
    }

    @Override
    public void visit(NodeVisitor v) {
        if (v.visit(this)) {
            getArguments().visit(v);
        }
    }
}
