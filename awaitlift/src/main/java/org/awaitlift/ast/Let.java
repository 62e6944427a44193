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
 * Let-binding expression {@code let var x = initializer in body}. The variable is in scope in the
 * body only, and the value of the expression is the value of the body. Node type is {@link
 * Token#LET}.
 */
public class Let extends Expression {

    private VariableDeclaration variable;
    private Expression body;

    {
        type = Token.LET;
    }

    public Let(VariableDeclaration variable, Expression body) {
        setVariable(variable);
        setBody(body);
    }

    public VariableDeclaration getVariable() {
        return variable;
    }

    public void setVariable(VariableDeclaration variable) {
        assertNotNull(variable);
        assertNotNull(variable.getInitializer());
        this.variable = variable;
        variable.setParent(this);
    }

    public Expression getBody() {
        return body;
    }

    public void setBody(Expression body) {
        assertNotNull(body);
        this.body = body;
        body.setParent(this);
    }

    @Override
    public StaticType getStaticType(StaticTypeContext context) {
        return body.getStaticType(context);
    }

    @Override
    public String toSource(int depth) {
        return "let " + variable.toDeclarationSource() + " in " + body.toSource(0);
    }

    @Override
    public void visit(NodeVisitor v) {
        if (v.visit(this)) {
            variable.visit(v);
            body.visit(v);
        }
    }
}
