/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.awaitlift.types;

import org.awaitlift.ast.Expression;

/**
 * Answers static-type queries for expressions of one enclosing member. The tree arrives fully
 * resolved, so this only reads the types recorded on the nodes and applies the few structural
 * rules (such as {@link #flatten}) the nodes delegate to.
 */
public class StaticTypeContext {

    private final StaticType thisType;

    public StaticTypeContext() {
        this(CoreTypes.OBJECT);
    }

    /** @param thisType the static type of {@code this} in the enclosing member */
    public StaticTypeContext(StaticType thisType) {
        if (thisType == null) {
            throw new IllegalArgumentException("thisType");
        }
        this.thisType = thisType;
    }

    public StaticType getStaticType(Expression expr) {
        return expr.getStaticType(this);
    }

    public StaticType getThisType() {
        return thisType;
    }

    /**
     * Returns the type an {@code await} of a value of the given type produces: the type argument
     * of {@code Future<T>} or {@code FutureOr<T>}, otherwise the type itself.
     */
    public StaticType flatten(StaticType type) {
        String name = type.getName();
        if ((name.equals(CoreTypes.FUTURE_NAME) || name.equals(CoreTypes.FUTURE_OR_NAME))
                && type.getTypeArguments().size() == 1) {
            return type.getTypeArguments().get(0);
        }
        return type;
    }
}
