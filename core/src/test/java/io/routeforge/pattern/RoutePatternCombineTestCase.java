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

package io.routeforge.pattern;

import io.routeforge.testutils.category.UnitTest;
import org.junit.Assert;
import org.junit.Test;
import org.junit.experimental.categories.Category;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static io.routeforge.pattern.RoutePatternFactory.combine;
import static io.routeforge.pattern.RoutePatternFactory.literalPart;
import static io.routeforge.pattern.RoutePatternFactory.parameterPart;
import static io.routeforge.pattern.RoutePatternFactory.pattern;
import static io.routeforge.pattern.RoutePatternFactory.segment;

/**
 * Tests for {@link RoutePatternFactory#combine(RoutePattern, RoutePattern)}.
 */
@Category(UnitTest.class)
public class RoutePatternCombineTestCase {

    private static RoutePattern users() {
        return pattern("users/{id}", segment(literalPart("users")), segment(parameterPart("id")));
    }

    private static RoutePattern action() {
        return pattern("/{action}", Map.of("action", "index"), null, segment(parameterPart("action")));
    }

    private static RoutePattern withDefaults(final String rawText, final Map<String, ?> defaults) {
        return pattern(rawText, defaults, null, segment(literalPart(rawText.substring(1))));
    }

    private static List<String> names(final List<RoutePatternParameterPart> parameters) {
        final List<String> names = new ArrayList<>();
        for (final RoutePatternParameterPart parameter : parameters) {
            names.add(parameter.getName());
        }
        return names;
    }

    @Test
    public void testCombine() {
        final RoutePattern left = users();
        final RoutePattern right = action();
        final RoutePattern combined = combine(left, right);

        Assert.assertEquals("users/{id}/{action}", combined.getRawText());
        Assert.assertEquals(List.of("id", "action"), names(combined.getParameters()));
        Assert.assertEquals(Map.of("action", "index"), combined.getDefaults());
        Assert.assertEquals(3, combined.getPathSegments().size());
        Assert.assertSame(left.getPathSegments().get(0), combined.getPathSegments().get(0));
        Assert.assertSame(right.getPathSegments().get(0), combined.getPathSegments().get(2));
        Assert.assertEquals("index", combined.getParameter("action").getDefault());
    }

    @Test
    public void testCombineJoinsRawTextWithOneSlash() {
        final RoutePattern left = pattern("/api/", segment(literalPart("api")));
        final RoutePattern right = pattern("//{action}", segment(parameterPart("action")));
        Assert.assertEquals("/api/{action}", combine(left, right).getRawText());

        final RoutePattern noRawText = pattern(List.of(segment(literalPart("api"))));
        Assert.assertEquals("/{action}", combine(noRawText, pattern("{action}", segment(parameterPart("action")))).getRawText());
    }

    @Test
    public void testCombineWithEmptySideReturnsOtherCollections() {
        final RoutePattern empty = pattern("/");
        final RoutePattern right = action();
        final RoutePattern combined = combine(empty, right);

        Assert.assertEquals("/{action}", combined.getRawText());
        Assert.assertSame(right.getPathSegments(), combined.getPathSegments());
        Assert.assertSame(right.getParameters(), combined.getParameters());
        Assert.assertSame(right.getDefaults(), combined.getDefaults());

        final RoutePattern reversed = combine(right, empty);
        Assert.assertSame(right.getParameters(), reversed.getParameters());
        Assert.assertEquals("/{action}/", reversed.getRawText());
    }

    @Test
    public void testCombineDuplicateParameter() {
        final RoutePattern left = users();
        final RoutePattern right = pattern("/{ID}/details", segment(parameterPart("ID")), segment(literalPart("details")));

        final RoutePatternException e = Assert.assertThrows(RoutePatternException.class, () -> combine(left, right));
        Assert.assertEquals("users/{id}/{ID}/details", e.getPattern());
        Assert.assertTrue(e.getMessage(), e.getMessage().contains("'ID'"));

        // inputs are untouched
        Assert.assertEquals(List.of("id"), names(left.getParameters()));
        Assert.assertEquals(List.of("ID"), names(right.getParameters()));
    }

    @Test
    public void testCombineDuplicateParameterUsesSameNameRulesAsMerge() {
        Assert.assertThrows(RoutePatternException.class,
                () -> pattern("/{\u0130d}/{id}", segment(parameterPart("\u0130d")), segment(parameterPart("id"))));

        final RoutePattern left = pattern("/{\u0130d}", segment(parameterPart("\u0130d")));
        final RoutePattern right = pattern("/{id}", segment(parameterPart("id")));
        final RoutePatternException e = Assert.assertThrows(RoutePatternException.class, () -> combine(left, right));
        Assert.assertEquals("/{\u0130d}/{id}", e.getPattern());
    }

    @Test
    public void testCombineDuplicateParameterMessageHasOneId() {
        final RoutePatternException e = Assert.assertThrows(RoutePatternException.class,
                () -> combine(users(), pattern("/{id}", segment(parameterPart("id")))));
        Assert.assertTrue(e.getMessage(), e.getMessage().startsWith("RF000012"));
        Assert.assertEquals(e.getMessage(), e.getMessage().indexOf("RF0"), e.getMessage().lastIndexOf("RF0"));
        Assert.assertTrue(e.getMessage(), e.getMessage().contains("users/{id}/{id}"));
    }

    @Test
    public void testCombineMatchingDefaults() {
        final RoutePattern combined = combine(
                withDefaults("/en", Map.of("lang", "en", "area", "shop")),
                withDefaults("/products", Map.of("LANG", "en"))
        );
        Assert.assertEquals(Map.of("lang", "en", "area", "shop"), combined.getDefaults());
        Assert.assertEquals("en", combined.getDefaults().get("Lang"));
    }

    @Test
    public void testCombineConflictingDefaults() {
        final IllegalStateException e = Assert.assertThrows(IllegalStateException.class, () -> combine(
                withDefaults("/en", Map.of("lang", "en")),
                withDefaults("/products", Map.of("lang", "fr"))
        ));
        Assert.assertTrue(e.getMessage(), e.getMessage().contains("'lang'"));
        Assert.assertTrue(e.getMessage(), e.getMessage().contains("/en/products"));
        Assert.assertTrue(e.getMessage(), e.getMessage().contains("defaults"));
    }

    @Test
    @SuppressWarnings("ThrowableResultIgnored")
    public void testCombineRequiredValuesAndPolicies() {
        final RoutePattern left = pattern("/admin", Map.of("area", "admin"), Map.of("token", "[a-f0-9]+"),
                Map.of("area", "admin"), segment(literalPart("admin")));
        final RoutePattern same = pattern("/users", Map.of("area", "admin"), Map.of("token", "[a-f0-9]+"),
                Map.of("area", "admin"), segment(literalPart("users")));
        final RoutePattern combined = combine(left, same);

        Assert.assertEquals(Map.of("area", "admin"), combined.getRequiredValues());
        Assert.assertEquals(left.getParameterPolicies(), combined.getParameterPolicies());

        final RoutePattern otherPolicy = pattern("/users", null, Map.of("token", "[0-9]+"), segment(literalPart("users")));
        Assert.assertThrows(IllegalStateException.class, () -> combine(left, otherPolicy));

        final RoutePattern otherRequired = pattern("/users", Map.of("area", "users"), null,
                Map.of("area", "users"), segment(literalPart("users")));
        Assert.assertThrows(IllegalStateException.class, () -> combine(left, otherRequired));
    }

    @Test
    public void testCombineIsAssociativeForParameters() {
        final RoutePattern nested = combine(combine(pattern("/a", segment(literalPart("a"))), users()), action());
        Assert.assertEquals("/a/users/{id}/{action}", nested.getRawText());
        Assert.assertEquals(List.of("id", "action"), names(nested.getParameters()));
        Assert.assertEquals(4, nested.getPathSegments().size());
    }

    @Test
    @SuppressWarnings("ThrowableResultIgnored")
    public void testCombineNullArguments() {
        Assert.assertThrows(IllegalArgumentException.class, () -> combine(null, users()));
        Assert.assertThrows(IllegalArgumentException.class, () -> combine(users(), null));
    }
}
