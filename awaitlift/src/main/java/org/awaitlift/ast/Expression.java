/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.awaitlift.ast;

import org.awaitlift.types.StaticType;
import org.awaitlift.types.StaticTypeContext;

/** Base class for expression nodes. Every expression has a resolved static type. */
public abstract class Expression extends TreeNode {

    public Expression() {}

    public abstract StaticType getStaticType(StaticTypeContext context);
}
