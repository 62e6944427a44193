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
 * AST node for a map literal {@code <K, V>{k: v}}. Entries are evaluated in order, each key
 * before its value. Node type is {@link Token#MAP_LITERAL}.
 */
public class MapLiteral extends Expression {

    private final List<MapLiteralEntry> entries = new ArrayList<>();
    private final StaticType keyType;
    private final StaticType valueType;

    {
        type = Token.MAP_LITERAL;
    }

    public MapLiteral(List<MapLiteralEntry> entries, StaticType keyType, StaticType valueType) {
        assertNotNull(keyType);
        assertNotNull(valueType);
        this.keyType = keyType;
        this.valueType = valueType;
        for (MapLiteralEntry entry : entries) {
            assertNotNull(entry);
            entry.setParent(this);
            this.entries.add(entry);
        }
    }

    public List<MapLiteralEntry> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    @Override
    public StaticType getStaticType(StaticTypeContext context) {
        return CoreTypes.map(keyType, valueType);
    }

    @Override
    public String toSource(int depth) {
        StringBuilder sb = new StringBuilder();
        sb.append('<').append(keyType).append(", ").append(valueType).append(">{");
        printList(entries, sb);
        return sb.append('}').toString();
    }

    @Override
    public void visit(NodeVisitor v) {
        if (v.visit(this)) {
            for (MapLiteralEntry entry : entries) {
                entry.visit(v);
            }
        }
    }
}
