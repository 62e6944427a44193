/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.awaitlift.ast;

import org.awaitlift.Token;

/** One {@code key: value} entry of a {@link MapLiteral}. Node type is {@link Token#MAP_ENTRY}. */
public class MapLiteralEntry extends TreeNode {

    private Expression key;
    private Expression value;

    {
        type = Token.MAP_ENTRY;
    }

    public MapLiteralEntry(Expression key, Expression value) {
        setKey(key);
        setValue(value);
    }

    public Expression getKey() {
        return key;
    }

    public void setKey(Expression key) {
        assertNotNull(key);
        this.key = key;
        key.setParent(this);
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
        return key.toSource(0) + ": " + value.toSource(0);
    }

    @Override
    public void visit(NodeVisitor v) {
        if (v.visit(this)) {
            key.visit(v);
            value.visit(v);
        }
    }
}
