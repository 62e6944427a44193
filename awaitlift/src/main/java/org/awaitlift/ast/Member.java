/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.awaitlift.ast;

import org.awaitlift.types.StaticType;

/**
 * A resolved reference to a top-level, static or super member. For fields and getters the type is
 * the value type; for procedures and constructors it is the result type of an invocation.
 */
public class Member {

    private final String name;
    private final StaticType type;

    public Member(String name, StaticType type) {
        if (name == null || type == null) {
            throw new IllegalArgumentException("name and type required");
        }
        this.name = name;
        this.type = type;
    }

    public String getName() {
        return name;
    }

    public StaticType getType() {
        return type;
    }

    @Override
    public String toString() {
        return name;
    }
}
