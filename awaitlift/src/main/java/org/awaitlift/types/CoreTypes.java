/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.awaitlift.types;

/** The core library types the lowering refers to by name. */
public final class CoreTypes {

    public static final StaticType BOOL = StaticType.of("bool");
    public static final StaticType INT = StaticType.of("int");
    public static final StaticType DOUBLE = StaticType.of("double");
    public static final StaticType STRING = StaticType.of("String");
    public static final StaticType NULL = StaticType.of("Null");
    public static final StaticType OBJECT = StaticType.of("Object");
    public static final StaticType SYMBOL = StaticType.of("Symbol");
    public static final StaticType TYPE = StaticType.of("Type");
    public static final StaticType FUNCTION = StaticType.of("Function");

    static final String FUTURE_NAME = "Future";
    static final String FUTURE_OR_NAME = "FutureOr";

    private CoreTypes() {}

    public static StaticType future(StaticType valueType) {
        return StaticType.of(FUTURE_NAME, valueType);
    }

    public static StaticType futureOr(StaticType valueType) {
        return StaticType.of(FUTURE_OR_NAME, valueType);
    }

    public static StaticType list(StaticType elementType) {
        return StaticType.of("List", elementType);
    }

    public static StaticType map(StaticType keyType, StaticType valueType) {
        return StaticType.of("Map", keyType, valueType);
    }
}
