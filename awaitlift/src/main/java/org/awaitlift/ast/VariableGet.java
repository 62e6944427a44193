/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.awaitlift.ast;

import org.awaitlift.Token;
import org.awaitlift.types.StaticType;
import org.awaitlift.types.StaticTypeContext;

/** Read of a local variable. Node type is {@link Token#VARIABLE_GET}. */
public class VariableGet extends Expression {

    private VariableDeclaration variable;

    {
        type = Token.VARIABLE_GET;
    }

    public VariableGet(VariableDeclaration variable) {
        setVariable(variable);
    }

    public VariableDeclaration getVariable() {
        return variable;
    }

    public void setVariable(VariableDeclaration variable) {
        assertNotNull(variable);
        this.variable = variable;
    }

    @Override
    public StaticType getStaticType(StaticTypeContext context) {
        return variable.getDeclaredType();
    }

    @Override
    public String toSource(int depth) {
        return variable.getName();
    }

    @Override
    public void visit(NodeVisitor v) {
        v.visit(this);
    }
}
