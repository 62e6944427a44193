/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.awaitlift.ast;

import org.awaitlift.Token;
import org.awaitlift.types.CoreTypes;
import org.awaitlift.types.StaticType;
import org.awaitlift.types.StaticTypeContext;

/** A function literal used as a value. Node type is {@link Token#FUNCTION_EXPRESSION}. */
public class FunctionExpression extends Expression {

    private FunctionNode function;

    {
        type = Token.FUNCTION_EXPRESSION;
    }

    public FunctionExpression(FunctionNode function) {
        setFunction(function);
    }

    public FunctionNode getFunction() {
        return function;
    }

    public void setFunction(FunctionNode function) {
        assertNotNull(function);
        this.function = function;
        function.setParent(this);
    }

    @Override
    public StaticType getStaticType(StaticTypeContext context) {
        return CoreTypes.FUNCTION;
    }

    @Override
    public String toSource(int depth) {
        return function.toSource(depth);
    }

    @Override
    public void visit(NodeVisitor v) {
        if (v.visit(this)) {
            function.visit(v);
        }
    }
}
