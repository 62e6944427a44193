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

/**
 * String interpolation: the string values of the parts, concatenated. Node type is {@link
 * Token#STRING_CONCATENATION}.
 */
public class StringConcatenation extends Expression {

    private final List<Expression> expressions = new ArrayList<>();

    {
        type = Token.STRING_CONCATENATION;
    }

    public StringConcatenation(List<? extends Expression> expressions) {
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

    @Override
    public StaticType getStaticType(StaticTypeContext context) {
        return CoreTypes.STRING;
    }

    @Override
    public String toSource(int depth) {
        StringBuilder sb = new StringBuilder("\"");
        for (Expression e : expressions) {
            if (e instanceof StringLiteral) {
                sb.append(((StringLiteral) e).getValue());
            } else {
                sb.append("${").append(e.toSource(0)).append('}');
            }
        }
        return sb.append('"').toString();
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
