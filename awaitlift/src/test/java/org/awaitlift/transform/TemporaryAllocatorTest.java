/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.awaitlift.transform;

import static org.junit.jupiter.api.Assertions.*;

import org.awaitlift.ast.VariableDeclaration;
import org.awaitlift.types.CoreTypes;
import org.awaitlift.types.StaticType;
import org.junit.jupiter.api.Test;

class TemporaryAllocatorTest {

    private final TemporaryAllocator allocator = new TemporaryAllocator(":t");

    @Test
    void firstOccupantDecidesType() {
        VariableDeclaration slot = allocator.allocate(0, CoreTypes.INT);
        assertEquals(":t0", slot.getName());
        assertEquals(CoreTypes.INT, slot.getDeclaredType());
        assertEquals(1, allocator.size());
    }

    @Test
    void sameTypeReuseKeepsType() {
        VariableDeclaration slot = allocator.allocate(0, CoreTypes.INT);
        for (int i = 0; i < 5; i++) {
            assertSame(slot, allocator.allocate(0, CoreTypes.INT));
        }
        assertEquals(CoreTypes.INT, slot.getDeclaredType());
    }

    @Test
    void conflictingTypeWidensOnce() {
        VariableDeclaration slot = allocator.allocate(0, CoreTypes.INT);
        assertSame(slot, allocator.allocate(0, CoreTypes.STRING));
        assertSame(StaticType.DYNAMIC, slot.getDeclaredType());

        // never narrowed again
        allocator.allocate(0, CoreTypes.INT);
        allocator.allocate(0, CoreTypes.STRING);
        assertSame(StaticType.DYNAMIC, slot.getDeclaredType());
    }

    @Test
    void structurallyEqualTypesDoNotWiden() {
        VariableDeclaration slot = allocator.allocate(0, CoreTypes.list(CoreTypes.INT));
        allocator.allocate(0, StaticType.of("List", StaticType.of("int")));
        assertEquals(CoreTypes.list(CoreTypes.INT), slot.getDeclaredType());
    }

    @Test
    void lowerSlotsTakeTypeOfFirstOccupant() {
        VariableDeclaration high = allocator.allocate(2, CoreTypes.INT);
        assertEquals(3, allocator.size());
        assertSame(high, allocator.getVariables().get(2));

        VariableDeclaration low = allocator.getVariables().get(0);
        assertSame(StaticType.DYNAMIC, low.getDeclaredType());

        assertSame(low, allocator.allocate(0, CoreTypes.STRING));
        assertEquals(CoreTypes.STRING, low.getDeclaredType());

        allocator.allocate(0, CoreTypes.BOOL);
        assertSame(StaticType.DYNAMIC, low.getDeclaredType());
    }

    @Test
    void dynamicRequestOnFreshSlot() {
        VariableDeclaration slot = allocator.allocate(0);
        assertSame(StaticType.DYNAMIC, slot.getDeclaredType());
        allocator.allocate(0, CoreTypes.INT);
        assertSame(StaticType.DYNAMIC, slot.getDeclaredType());
    }

    @Test
    void slotsAreNamedByIndex() {
        allocator.allocate(3, CoreTypes.INT);
        assertEquals(":t0", allocator.getVariables().get(0).getName());
        assertEquals(":t3", allocator.getVariables().get(3).getName());
    }

    @Test
    void negativeIndexIsACodeBug() {
        assertThrows(IllegalStateException.class, () -> allocator.allocate(-1, CoreTypes.INT));
    }
}
