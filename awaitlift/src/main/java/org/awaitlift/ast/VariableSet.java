/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.awaitlift.ast;

import org.awaitlift.Token;
import org.awaitlift.types.StaticType;
import org.awaitlift.types.StaticTypeContext;

/** Assignment to a local variable. Node type is {@link Token#VARIABLE_SET}. */
public class VariableSet extends Expression {

    private VariableDeclaration variable;
    private Expression value;

    {
        type = Token.VARIABLE_SET;
    }

    public VariableSet(VariableDeclaration variable, Expression value) {
        setVariable(variable);
        setValue(value);
    }

    public VariableDeclaration getVariable() {
        return variable;
    }

    public void setVariable(VariableDeclaration variable) {
        assertNotNull(variable);
        this.variable = variable;
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
        return variable.getName() + " = " + value.toSource(0);
    }

    @Override
    public void visit(NodeVisitor v) {
        if (v.visit(this)) {
            value.visit(v);
        }
    }
}
