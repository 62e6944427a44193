/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.awaitlift.ast;

import org.awaitlift.Token;

/** A named argument, {@code name: value}. Node type is {@link Token#NAMED_EXPRESSION}. */
public class NamedExpression extends TreeNode {

    private final String name;
    private Expression value;

    {
        type = Token.NAMED_EXPRESSION;
    }

    public NamedExpression(String name, Expression value) {
        assertNotNull(name);
        this.name = name;
        setValue(value);
    }

    public String getName() {
        return name;
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
    public String toSource(int depth) {
        return name + ": " + value.toSource(0);
    }

    @Override
    public void visit(NodeVisitor v) {
        if (v.visit(this)) {
            value.visit(v);
        }
    }
}
