/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.awaitlift.ast;

/**
 * Simple visitor interface for traversing the tree. The nodes decide the traversal order; a
 * visitor only decides whether to descend.
 */
public interface NodeVisitor {

    /**
     * Visits a tree node.
     *
     * @param node the tree node. Will never be {@code null}.
     * @return {@code true} if the children should be visited. If {@code false}, the subtree
     *     rooted at this node is skipped.
     */
    boolean visit(TreeNode node);
}
