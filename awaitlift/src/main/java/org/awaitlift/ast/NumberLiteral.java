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

/** AST node for an integer or double literal. Node type is {@link Token#NUMBER}. */
public class NumberLiteral extends Expression {

    private Number value;

    {
        type = Token.NUMBER;
    }

    public NumberLiteral(Number value) {
        setValue(value);
    }

    public Number getValue() {
        return value;
    }

    /**
     * Sets the literal value, an {@link Integer}, {@link Long} or {@link Double}.
     *
     * @throws IllegalArgumentException if value is {@code null}
     */
    public void setValue(Number value) {
        assertNotNull(value);
        this.value = value;
    }

    public boolean isInteger() {
        return value instanceof Integer || value instanceof Long;
    }

    @Override
    public StaticType getStaticType(StaticTypeContext context) {
        return isInteger() ? CoreTypes.INT : CoreTypes.DOUBLE;
    }

    @Override
    public String toSource(int depth) {
        return value.toString();
    }

    /** Visits this node. There are no children to visit. */
    @Override
    public void visit(NodeVisitor v) {
        v.visit(this);
    }
}
