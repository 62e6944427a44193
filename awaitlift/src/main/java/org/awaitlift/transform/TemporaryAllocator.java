/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.awaitlift.transform;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;
import org.awaitlift.Kit;
import org.awaitlift.ast.VariableDeclaration;
import org.awaitlift.types.StaticType;

/**
 * Numbered temporary variables for one function body. Slots are created on first use and never
 * released; all of them are declared once at the top of the lowered body.
 *
 * <p>A slot takes the type of its first occupant. Reusing it at a different type widens it to
 * {@link StaticType#DYNAMIC} for good, so every read of a slot must reassert the type it expects
 * with an {@code unsafeCast}.
 */
public class TemporaryAllocator {

    private final String prefix;
    private final List<VariableDeclaration> variables = new ArrayList<>();

    // Slots created only because a higher index was requested first. They have no occupant yet
    // and take the type of their first one.
    private final BitSet unoccupied = new BitSet();

    public TemporaryAllocator(String prefix) {
        this.prefix = prefix;
    }

    VariableDeclaration allocate(int index) {
        return allocate(index, StaticType.DYNAMIC);
    }

    /**
     * Returns the slot with the given index, creating it and every lower slot if needed.
     *
     * @param index slot number, counted from zero
     * @param type the static type of the value about to be stored in the slot
     */
    public VariableDeclaration allocate(int index, StaticType type) {
        if (index < 0) throw Kit.codeBug("negative temporary index " + index);
        if (variables.size() > index) {
            VariableDeclaration variable = variables.get(index);
            if (unoccupied.get(index)) {
                unoccupied.clear(index);
                variable.setDeclaredType(type);
            } else if (!variable.getDeclaredType().isDynamic()
                    && !variable.getDeclaredType().equals(type)) {
                variable.setDeclaredType(StaticType.DYNAMIC);
            }
            return variable;
        }
        for (int i = variables.size(); i <= index; i++) {
            if (i == index) {
                variables.add(new VariableDeclaration(prefix + i, type));
            } else {
                variables.add(new VariableDeclaration(prefix + i));
                unoccupied.set(i);
            }
        }
        return variables.get(index);
    }

    /** Returns the slots allocated so far, in index order. */
    public List<VariableDeclaration> getVariables() {
        return Collections.unmodifiableList(variables);
    }

    int size() {
        return variables.size();
    }
}
