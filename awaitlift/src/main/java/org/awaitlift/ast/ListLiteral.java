/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.awaitlift.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.awaitlift.Token;
import org.awaitlift.types.CoreTypes;
import org.awaitlift.types.StaticType;
import org.awaitlift.types.StaticTypeContext;

/** AST node for a list literal {@code <T>[a, b]}. Node type is {@link Token#LIST_LITERAL}. */
public class ListLiteral extends Expression {

    private final List<Expression> expressions = new ArrayList<>();
    private final StaticType typeArgument;

    {
        type = Token.LIST_LITERAL;
    }

    public ListLiteral(List<? extends Expression> expressions, StaticType typeArgument) {
        assertNotNull(typeArgument);
        this.typeArgument = typeArgument;
        for (Expression e : expressions) {
            assertNotNull(e);
            e.setParent(this);
            this.expressions.add(e);
        }
    }

    public List<Expression> getExpressions() {
        return Collections.unmodifiableList(expressions);
    }

    public void setExpression(int index, Expression expression) {
        assertNotNull(expression);
        expressions.set(index, expression);
        expression.setParent(this);
    }

    public StaticType getTypeArgument() {
        return typeArgument;
    }

    @Override
    public StaticType getStaticType(StaticTypeContext context) {
        return CoreTypes.list(typeArgument);
    }

    @Override
    public String toSource(int depth) {
        StringBuilder sb = new StringBuilder();
        sb.append('<').append(typeArgument).append(">[");
        printList(expressions, sb);
        return sb.append(']').toString();
    }

    @Override
    public void visit(NodeVisitor v) {
        if (v.visit(this)) {
            for (Expression e : expressions) {
                e.visit(v);
            }
        }
    }
}
