/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.awaitlift.types;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A resolved static type: a class name with type arguments, or one of the special types {@link
 * #DYNAMIC} and {@link #NEVER}. Instances are immutable and compared structurally.
 */
public final class StaticType {

    /** The universal type. A temporary widened to it accepts every value. */
    public static final StaticType DYNAMIC = new StaticType("dynamic", Collections.emptyList());

    /** The bottom type, the static type of {@code throw} and {@code rethrow}. */
    public static final StaticType NEVER = new StaticType("Never", Collections.emptyList());

    private final String name;
    private final List<StaticType> typeArguments;

    private StaticType(String name, List<StaticType> typeArguments) {
        this.name = name;
        this.typeArguments = typeArguments;
    }

    public static StaticType of(String name, StaticType... typeArguments) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("type name required");
        }
        if (typeArguments.length == 0) {
            if (name.equals(DYNAMIC.name)) return DYNAMIC;
            if (name.equals(NEVER.name)) return NEVER;
        }
        return new StaticType(name, Collections.unmodifiableList(Arrays.asList(typeArguments)));
    }

    public String getName() {
        return name;
    }

    public List<StaticType> getTypeArguments() {
        return typeArguments;
    }

    public boolean isDynamic() {
        return this == DYNAMIC;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof StaticType)) return false;
        StaticType other = (StaticType) obj;
        return name.equals(other.name) && typeArguments.equals(other.typeArguments);
    }

    @Override
    public int hashCode() {
        return name.hashCode() * 31 + typeArguments.hashCode();
    }

    @Override
    public String toString() {
        if (typeArguments.isEmpty()) {
            return name;
        }
        StringBuilder sb = new StringBuilder(name);
        sb.append('<');
        for (int i = 0; i < typeArguments.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(typeArguments.get(i));
        }
        sb.append('>');
        return sb.toString();
    }
}
