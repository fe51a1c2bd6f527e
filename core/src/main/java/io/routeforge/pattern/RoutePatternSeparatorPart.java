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

import java.util.Objects;

/**
 * Text that separates two parameters inside a complex segment, for example the '.' in {@code /{name}.{extension?}}. When the
 * parameter that follows a separator is optional and absent, the separator is dropped as well.
 *
 * Instances of this class are immutable.
 *
 * @author RouteForge contributors
 */
public final class RoutePatternSeparatorPart extends RoutePatternPart {

    private final String content;

    RoutePatternSeparatorPart(final String content) {
        super(RoutePatternPartKind.SEPARATOR);
        this.content = Objects.requireNonNull(content);
    }

    public String getContent() {
        return content;
    }

    @Override
    public String toString() {
        return content;
    }

    @Override
    public int hashCode() {
        int hash = 3;
        hash = 59 * hash + content.hashCode();
        return hash;
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null) {
            return false;
        }
        if (getClass() != obj.getClass()) {
            return false;
        }
        final RoutePatternSeparatorPart other = (RoutePatternSeparatorPart) obj;
        return content.equals(other.content);
    }
}
