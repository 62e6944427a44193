/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.awaitlift.ast;

import java.util.List;
import org.awaitlift.Token;

/**
 * Base class for every node of the resolved tree. Nodes form a tree, not a DAG: each node has at
 * most one parent, and setting a child through one of the typed setters also sets the child's
 * parent. The lowering replaces children in place through those setters.
 */
public abstract class TreeNode {

    protected int type = Token.ERROR;
    protected TreeNode parent;
    protected int fileOffset = -1;

    public TreeNode() {}

    /** Returns the node type, one of the {@link Token} constants. */
    public int getType() {
        return type;
    }

    public void setType(int type) {
        this.type = type;
    }

    public TreeNode getParent() {
        return parent;
    }

    /**
     * Sets the node parent. This method does not remove the node from any list kept by the
     * previous parent; callers replacing children use the parent's own setters.
     */
    public void setParent(TreeNode parent) {
        this.parent = parent;
    }

    /** Returns the source offset this node was created for, or -1 if unknown. */
    public int getFileOffset() {
        return fileOffset;
    }

    public void setFileOffset(int fileOffset) {
        this.fileOffset = fileOffset;
    }

    /**
     * Emits source code for this node. Statements render on a single line; {@code depth} only
     * controls leading indentation.
     *
     * @param depth the current recursive depth
     */
    public abstract String toSource(int depth);

    public String toSource() {
        return toSource(0);
    }

    /**
     * Visits this node and its children in an arbitrary order, calling {@link
     * NodeVisitor#visit(TreeNode)} for each one. Children are not visited if the visitor returns
     * {@code false} for their parent.
     */
    public abstract void visit(NodeVisitor visitor);

    protected String makeIndent(int indent) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < indent; i++) {
            sb.append("  ");
        }
        return sb.toString();
    }

    /** Prints a comma-separated item list into a {@link StringBuilder}. */
    protected static <T extends TreeNode> void printList(List<T> items, StringBuilder sb) {
        int max = items.size();
        int count = 0;
        for (TreeNode item : items) {
            sb.append(item.toSource(0));
            if (count++ < max - 1) {
                sb.append(", ");
            }
        }
    }

    /**
     * Bounces an IllegalArgumentException up if arg is {@code null}.
     *
     * @param arg any method argument
     * @throws IllegalArgumentException if the argument is {@code null}
     */
    protected void assertNotNull(Object arg) {
        if (arg == null) throw new IllegalArgumentException("arg cannot be null");
    }

    @Override
    public String toString() {
        return Token.typeToName(type) + " " + toSource(0);
    }
}
