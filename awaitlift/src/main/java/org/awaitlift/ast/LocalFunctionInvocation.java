/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.awaitlift.ast;

import org.awaitlift.Token;
import org.awaitlift.types.StaticType;

/**
 * Call of a local function declared in the same body, {@code f(arguments)}. The callee is a
 * binding, not an evaluated subexpression. Node type is {@link Token#LOCAL_FUNCTION_INVOCATION}.
 */
public class LocalFunctionInvocation extends InvocationExpression {

    private final VariableDeclaration variable;

    {
        type = Token.LOCAL_FUNCTION_INVOCATION;
    }

    public LocalFunctionInvocation(
            VariableDeclaration variable, Arguments arguments, StaticType resultType) {
        super(arguments, resultType);
        assertNotNull(variable);
        this.variable = variable;
    }

    public VariableDeclaration getVariable() {
        return variable;
    }

    @Override
    public String toSource(int depth) {
        return variable.getName() + getArguments().toSource(0);
    }

    @Override
    public void visit(NodeVisitor v) {
        if (v.visit(this)) {
            getArguments().visit(v);
        }
    }
}
