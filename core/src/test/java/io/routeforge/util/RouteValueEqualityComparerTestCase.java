/*
 * JBoss, Home of Professional Open Source.
 * Copyright 2025 Red Hat, Inc., and individual contributors
 * as indicated by the @author tags.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */

package io.routeforge.util;

import io.routeforge.testutils.category.UnitTest;
import org.junit.Assert;
import org.junit.Test;
import org.junit.experimental.categories.Category;

@Category(UnitTest.class)
public class RouteValueEqualityComparerTestCase {

    private final RouteValueEqualityComparer comparer = RouteValueEqualityComparer.DEFAULT;

    @Test
    public void testNullAndEmptyAreEquivalent() {
        Assert.assertTrue(comparer.equals(null, ""));
        Assert.assertTrue(comparer.equals("", null));
        Assert.assertTrue(comparer.equals(null, null));
        Assert.assertFalse(comparer.equals(null, "a"));
        Assert.assertFalse(comparer.equals("a", ""));
    }

    @Test
    public void testValuesAreComparedAsStringsIgnoringCase() {
        Assert.assertTrue(comparer.equals("Index", "index"));
        Assert.assertTrue(comparer.equals(5, "5"));
        Assert.assertTrue(comparer.equals(Boolean.TRUE, "TRUE"));
        Assert.assertFalse(comparer.equals(5, 6));
        Assert.assertFalse(comparer.equals("en", "fr"));
    }

    @Test
    public void testHashCodeIsConsistentWithEquals() {
        Assert.assertEquals(comparer.hashCode("Index"), comparer.hashCode("INDEX"));
        Assert.assertEquals(comparer.hashCode(null), comparer.hashCode(""));
        Assert.assertEquals(comparer.hashCode(5), comparer.hashCode("5"));
    }

    @Test
    public void testHashCodeFoldsCaseOneCharacterAtATime() {
        // dotted capital I lower-cases to two chars as a whole string
        Assert.assertTrue(comparer.equals("\u0130", "i"));
        Assert.assertEquals(comparer.hashCode("\u0130"), comparer.hashCode("i"));
        Assert.assertEquals(comparer.hashCode("\u0130d"), comparer.hashCode("ID"));
    }
}
