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

import io.routeforge.RouteForgeLogger;
import io.routeforge.RouteForgeMessages;
import io.routeforge.constraint.ParameterPolicy;
import io.routeforge.constraint.RegexRouteConstraint;
import io.routeforge.constraint.RouteConstraint;
import io.routeforge.util.RouteValueEqualityComparer;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Consumer;

/**
 * Factory methods for creating {@link RoutePattern} instances and the parts they consist of.
 *
 * <p>
 * Patterns are assembled from segments that are either built with the part factory methods of this class or produced by a
 * {@link RoutePatternTokenizer}. Default values, parameter policies and required values may be supplied <i>inline</i>, as part
 * of the parameter parts, or <i>out-of-line</i>, as maps keyed by parameter name. Every factory method that creates a pattern
 * merges the two sources so that both views of a pattern describe the same defaults and policies.</p>
 *
 * <p>
 * Two patterns can be joined end-to-end with {@link #combine(RoutePattern, RoutePattern)}, which is how the pattern of a route
 * group is prefixed to the patterns of the routes inside the group.</p>
 *
 * <p>
 * All methods fail fast. An exception is thrown before any pattern is returned and arguments are never modified.</p>
 *
 * @author RouteForge contributors
 */
public class RoutePatternFactory {

    //<editor-fold defaultstate="collapsed" desc="Design and implementation notes">
    /*
    Implementation Notes

        1.  Out-of-line defaults and policies are copied into working maps before the segments are visited. The working maps
            are the single source of truth while a pattern is built: parameter parts are rebuilt from them and inline values
            that are not yet present are written back into them. Once all segments were visited the working maps become the
            flat views of the pattern.

        2.  Segments and parts are rewritten by returning either the original instance or a new instance. A segment is only
            copied if at least one of its parts changed, so building a pattern without out-of-line data allocates nothing
            except the pattern itself.

        3.  Combining two patterns never re-runs the merge. Both patterns are already consistent, only overlap between them
            needs to be reconciled.
     */
    //</editor-fold>

    /**
     * System property that, when set to {@code true}, makes parameter parts created without an explicit {@code encodeSlashes}
     * flag leave '/' characters unencoded.
     */
    public static final String DISABLE_SLASH_ENCODING_PROPERTY = "io.routeforge.pattern.disable-slash-encoding";

    static final boolean DEFAULT_ENCODE_SLASHES = !Boolean.getBoolean(DISABLE_SLASH_ENCODING_PROPERTY);

    private static final char[] INVALID_PARAMETER_NAME_CHARS = new char[]{'/', '{', '}', '?', '*'};

    private static final String DEFAULTS = "defaults";
    private static final String PARAMETER_POLICIES = "parameter policies";
    private static final String REQUIRED_VALUES = "required values";

    static {
        if (!DEFAULT_ENCODE_SLASHES) {
            RouteForgeLogger.PATTERN_LOGGER.slashEncodingDisabled(DISABLE_SLASH_ENCODING_PROPERTY);
        }
    }

    private RoutePatternFactory() {
    }

    //<editor-fold defaultstate="collapsed" desc="Parse">
    /**
     * Creates a route pattern from a template string.
     *
     * @param tokenizer The tokenizer that splits the template into segments.
     * @param pattern   The template string.
     *
     * @return The route pattern.
     */
    public static RoutePattern parse(final RoutePatternTokenizer tokenizer, final String pattern) {
        return parse(tokenizer, pattern, null, null, null);
    }

    /**
     * Creates a route pattern from a template string along with out-of-line default values and parameter policies.
     *
     * @param tokenizer         The tokenizer that splits the template into segments.
     * @param pattern           The template string.
     * @param defaults          Additional default values. May be {@code null}.
     * @param parameterPolicies Additional parameter policies. May be {@code null}.
     *
     * @return The route pattern.
     */
    public static RoutePattern parse(
            final RoutePatternTokenizer tokenizer,
            final String pattern,
            final Map<String, ?> defaults,
            final Map<String, ?> parameterPolicies
    ) {
        return parse(tokenizer, pattern, defaults, parameterPolicies, null);
    }

    /**
     * Creates a route pattern from a template string along with out-of-line default values, parameter policies and required
     * values.
     *
     * @param tokenizer         The tokenizer that splits the template into segments.
     * @param pattern           The template string.
     * @param defaults          Additional default values. May be {@code null}.
     * @param parameterPolicies Additional parameter policies. May be {@code null}.
     * @param requiredValues    Required values. May be {@code null}.
     *
     * @return The route pattern.
     */
    public static RoutePattern parse(
            final RoutePatternTokenizer tokenizer,
            final String pattern,
            final Map<String, ?> defaults,
            final Map<String, ?> parameterPolicies,
            final Map<String, ?> requiredValues
    ) {
        if (tokenizer == null) {
            throw RouteForgeMessages.MESSAGES.argumentCannotBeNull("tokenizer");
        }
        if (pattern == null) {
            throw RouteForgeMessages.MESSAGES.argumentCannotBeNull("pattern");
        }
        final List<RoutePatternPathSegment> segments = tokenizer.tokenize(pattern);
        if (segments == null) {
            throw RouteForgeMessages.MESSAGES.argumentCannotBeNull("segments");
        }
        return patternCore(pattern, defaults, parameterPolicies, requiredValues, segments);
    }

    //</editor-fold>
    //
    //<editor-fold defaultstate="collapsed" desc="Pattern">
    public static RoutePattern pattern(final RoutePatternPathSegment... segments) {
        return pattern(null, null, null, null, segmentList(segments));
    }

    public static RoutePattern pattern(final Iterable<RoutePatternPathSegment> segments) {
        return pattern(null, null, null, null, segments);
    }

    public static RoutePattern pattern(final String rawText, final RoutePatternPathSegment... segments) {
        return pattern(rawText, null, null, null, segmentList(segments));
    }

    public static RoutePattern pattern(final String rawText, final Iterable<RoutePatternPathSegment> segments) {
        return pattern(rawText, null, null, null, segments);
    }

    public static RoutePattern pattern(
            final String rawText,
            final Map<String, ?> defaults,
            final Map<String, ?> parameterPolicies,
            final RoutePatternPathSegment... segments
    ) {
        return pattern(rawText, defaults, parameterPolicies, null, segmentList(segments));
    }

    public static RoutePattern pattern(
            final String rawText,
            final Map<String, ?> defaults,
            final Map<String, ?> parameterPolicies,
            final Iterable<RoutePatternPathSegment> segments
    ) {
        return pattern(rawText, defaults, parameterPolicies, null, segments);
    }

    public static RoutePattern pattern(
            final String rawText,
            final Map<String, ?> defaults,
            final Map<String, ?> parameterPolicies,
            final Map<String, ?> requiredValues,
            final RoutePatternPathSegment... segments
    ) {
        return pattern(rawText, defaults, parameterPolicies, requiredValues, segmentList(segments));
    }

    /**
     * Creates a route pattern from a sequence of segments along with out-of-line default values, parameter policies and
     * required values.
     *
     * <p>
     * The values of {@code parameterPolicies} may be a {@link ParameterPolicy}, a {@link String} or an {@link Iterable} or
     * array of those. Strings are converted to {@link RegexRouteConstraint}s that must match the entire value.</p>
     *
     * <p>
     * Each required value must either be {@code null} or empty, correspond to a parameter or be equal to the default value
     * with the same name.</p>
     *
     * @param rawText           The text the pattern was created from. May be {@code null}.
     * @param defaults          Additional default values. May be {@code null}.
     * @param parameterPolicies Additional parameter policies. May be {@code null}.
     * @param requiredValues    Required values. May be {@code null}.
     * @param segments          The segments.
     *
     * @return The route pattern.
     *
     * @throws IllegalArgumentException If an argument is invalid.
     * @throws IllegalStateException    If the inline and out-of-line data of the pattern contradict each other.
     * @throws RoutePatternException    If a parameter name appears more than once.
     */
    public static RoutePattern pattern(
            final String rawText,
            final Map<String, ?> defaults,
            final Map<String, ?> parameterPolicies,
            final Map<String, ?> requiredValues,
            final Iterable<RoutePatternPathSegment> segments
    ) {
        if (segments == null) {
            throw RouteForgeMessages.MESSAGES.argumentCannotBeNull("segments");
        }
        return patternCore(rawText, defaults, parameterPolicies, requiredValues, segments);
    }

    private static List<RoutePatternPathSegment> segmentList(final RoutePatternPathSegment[] segments) {
        if (segments == null) {
            throw RouteForgeMessages.MESSAGES.argumentCannotBeNull("segments");
        }
        return Arrays.asList(segments);
    }

    private static RoutePattern patternCore(
            final String rawText,
            final Map<String, ?> defaults,
            final Map<String, ?> parameterPolicies,
            final Map<String, ?> requiredValues,
            final Iterable<RoutePatternPathSegment> segments
    ) {
        final PatternMerger merger = new PatternMerger(
                rawText,
                copyValues(defaults, DEFAULTS),
                copyParameterPolicies(parameterPolicies)
        );

        final List<RoutePatternPathSegment> updatedSegments = new ArrayList<>();
        for (final RoutePatternPathSegment segment : segments) {
            if (segment == null) {
                throw RouteForgeMessages.MESSAGES.argumentCannotBeNull("segments");
            }
            updatedSegments.add(merger.visitSegment(segment));
        }

        final Map<String, Object> updatedRequiredValues = copyValues(requiredValues, REQUIRED_VALUES);
        if (updatedRequiredValues != null) {
            merger.checkRequiredValues(updatedRequiredValues);
        }

        if (defaults != null || parameterPolicies != null) {
            RouteForgeLogger.PATTERN_LOGGER.mergedRoutePattern(
                    rawText,
                    defaults == null ? 0 : defaults.size(),
                    parameterPolicies == null ? 0 : parameterPolicies.size(),
                    merger.parameters.size()
            );
        }

        return new RoutePattern(
                rawText,
                readOnly(merger.updatedDefaults),
                merger.policiesView(),
                readOnly(updatedRequiredValues),
                merger.parameters.isEmpty()
                        ? Collections.emptyList()
                        : Collections.unmodifiableList(merger.parameters),
                Collections.unmodifiableList(updatedSegments)
        );
    }

    /**
     * Rewrites the segments of a pattern against the working maps.
     */
    private static final class PatternMerger {

        private final String rawText;
        private Map<String, Object> updatedDefaults;
        private Map<String, List<RoutePatternParameterPolicyReference>> updatedParameterPolicies;
        private final List<RoutePatternParameterPart> parameters = new ArrayList<>();
        private final Set<String> parameterNames = newNameSet();

        private PatternMerger(
                final String rawText,
                final Map<String, Object> updatedDefaults,
                final Map<String, List<RoutePatternParameterPolicyReference>> updatedParameterPolicies
        ) {
            this.rawText = rawText;
            this.updatedDefaults = updatedDefaults;
            this.updatedParameterPolicies = updatedParameterPolicies;
        }

        private RoutePatternPathSegment visitSegment(final RoutePatternPathSegment segment) {
            final List<RoutePatternPart> parts = segment.getParts();
            RoutePatternPart[] updatedParts = null;
            for (int i = 0; i < parts.size(); ++i) {
                final RoutePatternPart part = parts.get(i);
                final RoutePatternPart updatedPart = visitPart(part);
                if (updatedPart.isParameter()) {
                    parameters.add((RoutePatternParameterPart) updatedPart);
                }

                if (part != updatedPart) {
                    if (updatedParts == null) {
                        updatedParts = parts.toArray(new RoutePatternPart[0]);
                    }
                    updatedParts[i] = updatedPart;
                }
            }

            if (updatedParts == null) {
                return segment;
            }
            return new RoutePatternPathSegment(Arrays.asList(updatedParts));
        }

        private RoutePatternPart visitPart(final RoutePatternPart part) {
            if (!part.isParameter()) {
                return part;
            }

            final RoutePatternParameterPart parameter = (RoutePatternParameterPart) part;
            final String name = parameter.getName();
            if (!parameterNames.add(name)) {
                throw new RoutePatternException(rawText, RouteForgeMessages.MESSAGES.repeatedParameter(rawText, name));
            }

            Object defaultValue = parameter.getDefault();
            if (updatedDefaults != null && updatedDefaults.containsKey(name)) {
                final Object newDefault = updatedDefaults.get(name);
                if (parameter.getDefault() != null && !parameter.getDefault().equals(newDefault)) {
                    throw RouteForgeMessages.MESSAGES.defaultSpecifiedInlineAndExplicitly(
                            rawText, name, parameter.getDefault(), newDefault
                    );
                }
                if (parameter.isOptional()) {
                    throw RouteForgeMessages.MESSAGES.optionalCannotHaveDefaultValue(rawText, name);
                }
                defaultValue = newDefault;
            }

            if (parameter.getDefault() != null) {
                if (updatedDefaults == null) {
                    updatedDefaults = newValueMap();
                }
                updatedDefaults.put(name, parameter.getDefault());
            }

            final List<RoutePatternParameterPolicyReference> inlinePolicies = parameter.getParameterPolicies();
            List<RoutePatternParameterPolicyReference> parameterConstraints = updatedParameterPolicies == null
                    ? null
                    : updatedParameterPolicies.get(name);
            if (!inlinePolicies.isEmpty()) {
                if (parameterConstraints == null) {
                    if (updatedParameterPolicies == null) {
                        updatedParameterPolicies = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
                    }
                    parameterConstraints = new ArrayList<>(inlinePolicies.size());
                    updatedParameterPolicies.put(name, parameterConstraints);
                    parameterConstraints.addAll(inlinePolicies);
                } else {
                    // out-of-line references come first, references supplied both ways are kept once
                    final List<RoutePatternParameterPolicyReference> outOfLine = List.copyOf(parameterConstraints);
                    for (final RoutePatternParameterPolicyReference reference : inlinePolicies) {
                        if (!outOfLine.contains(reference)) {
                            parameterConstraints.add(reference);
                        }
                    }
                }
            }

            final List<RoutePatternParameterPolicyReference> policies = parameterConstraints == null
                    ? Collections.emptyList()
                    : parameterConstraints;
            if (Objects.equals(parameter.getDefault(), defaultValue) && inlinePolicies.equals(policies)) {
                return part;
            }

            final RoutePatternParameterPart updated = new RoutePatternParameterPart(
                    name,
                    defaultValue,
                    parameter.getParameterKind(),
                    policies,
                    parameter.isEncodeSlashes()
            );
            RouteForgeLogger.PATTERN_LOGGER.tracef("Route pattern '%s': rebuilt parameter %s as %s", rawText, parameter, updated);
            return updated;
        }

        /*
        Each required value needs to either:
            1. be null-ish
            2. have a corresponding parameter
            3. have a corresponding default that matches both key and value
         */
        private void checkRequiredValues(final Map<String, Object> requiredValues) {
            final RouteValueEqualityComparer comparer = RouteValueEqualityComparer.DEFAULT;
            for (final Map.Entry<String, Object> entry : requiredValues.entrySet()) {
                final String key = entry.getKey();
                final Object value = entry.getValue();

                boolean found = comparer.equals("", value);
                if (!found) {
                    found = parameterNames.contains(key);
                }
                if (!found && updatedDefaults != null && updatedDefaults.containsKey(key)) {
                    found = comparer.equals(value, updatedDefaults.get(key));
                }

                if (!found) {
                    throw RouteForgeMessages.MESSAGES.unsatisfiedRequiredValue(rawText, key, value);
                }
            }
        }

        private Map<String, List<RoutePatternParameterPolicyReference>> policiesView() {
            if (updatedParameterPolicies == null || updatedParameterPolicies.isEmpty()) {
                return Collections.emptyMap();
            }
            final Map<String, List<RoutePatternParameterPolicyReference>> result = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
            for (final Map.Entry<String, List<RoutePatternParameterPolicyReference>> entry : updatedParameterPolicies.entrySet()) {
                result.put(entry.getKey(), List.copyOf(entry.getValue()));
            }
            return Collections.unmodifiableMap(result);
        }
    }

    //</editor-fold>
    //
    //<editor-fold defaultstate="collapsed" desc="Working maps">
    private static Map<String, Object> newValueMap() {
        return new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    }

    private static Set<String> newNameSet() {
        return new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
    }

    private static Map<String, Object> copyValues(final Map<String, ?> values, final String dictionaryName) {
        if (values == null || values.isEmpty()) {
            return null;
        }

        final Map<String, Object> result = newValueMap();
        for (final Map.Entry<String, ?> entry : values.entrySet()) {
            final String key = entry.getKey();
            if (key == null) {
                throw RouteForgeMessages.MESSAGES.argumentCannotBeNull(dictionaryName);
            }
            if (result.containsKey(key)) {
                throw RouteForgeMessages.MESSAGES.duplicateKey(dictionaryName, key);
            }
            result.put(key, entry.getValue());
        }
        return result;
    }

    private static Map<String, List<RoutePatternParameterPolicyReference>> copyParameterPolicies(
            final Map<String, ?> parameterPolicies
    ) {
        if (parameterPolicies == null || parameterPolicies.isEmpty()) {
            return null;
        }

        final Map<String, List<RoutePatternParameterPolicyReference>> result = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for (final Map.Entry<String, ?> entry : parameterPolicies.entrySet()) {
            final String key = entry.getKey();
            if (key == null) {
                throw RouteForgeMessages.MESSAGES.argumentCannotBeNull(PARAMETER_POLICIES);
            }
            if (result.containsKey(key)) {
                throw RouteForgeMessages.MESSAGES.duplicateKey(PARAMETER_POLICIES, key);
            }
            result.put(key, policyReferences(entry.getValue()));
        }
        return result;
    }

    private static <V> Map<String, V> readOnly(final Map<String, V> values) {
        if (values == null || values.isEmpty()) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(values);
    }

    //</editor-fold>
    //
    //<editor-fold defaultstate="collapsed" desc="Policy values">
    /**
     * The shapes an out-of-line parameter policy value can take.
     */
    enum PolicyValueShape {
        /**
         * An instantiated {@link ParameterPolicy}.
         */
        POLICY,
        /**
         * A regular expression that the whole value must match.
         */
        REGEX_TEXT,
        /**
         * An {@link Iterable} or array of policies and regular expressions.
         */
        MULTIPLE;

        static PolicyValueShape classify(final Object value) {
            if (value instanceof ParameterPolicy) {
                return POLICY;
            }
            if (value instanceof String) {
                return REGEX_TEXT;
            }
            if (value instanceof Iterable || value instanceof Object[]) {
                return MULTIPLE;
            }
            throw RouteForgeMessages.MESSAGES.invalidConstraintReference(value == null ? "null" : value, RouteConstraint.class.getName());
        }
    }

    private static List<RoutePatternParameterPolicyReference> policyReferences(final Object value) {
        final List<RoutePatternParameterPolicyReference> references = new ArrayList<>();
        switch (PolicyValueShape.classify(value)) {
            case POLICY:
                references.add(parameterPolicy((ParameterPolicy) value));
                break;
            case REGEX_TEXT:
                references.add(constraintCore(value));
                break;
            case MULTIPLE:
                final Iterable<?> items = value instanceof Object[] ? Arrays.asList((Object[]) value) : (Iterable<?>) value;
                for (final Object item : items) {
                    references.add(item instanceof ParameterPolicy
                            ? parameterPolicy((ParameterPolicy) item)
                            : constraintCore(item));
                }
                break;
            default:
                throw new IllegalStateException();
        }
        return references;
    }

    private static RoutePatternParameterPolicyReference constraintCore(final Object constraint) {
        if (constraint instanceof RouteConstraint) {
            return new RoutePatternParameterPolicyReference((RouteConstraint) constraint);
        }
        if (constraint instanceof String) {
            return new RoutePatternParameterPolicyReference(new RegexRouteConstraint("^(" + constraint + ")$"));
        }
        throw RouteForgeMessages.MESSAGES.invalidConstraintReference(
                constraint == null ? "null" : constraint, RouteConstraint.class.getName()
        );
    }

    //</editor-fold>
    //
    //<editor-fold defaultstate="collapsed" desc="Combine">
    /**
     * Joins two route patterns end-to-end, for example to prefix the pattern of a route group to the pattern of a route inside
     * the group.
     *
     * <p>
     * The segments and parameters of {@code right} follow those of {@code left}. Defaults, parameter policies and required
     * values are merged; a key that appears in both patterns must map to equal values.</p>
     *
     * @param left  The leading pattern.
     * @param right The trailing pattern.
     *
     * @return The combined pattern.
     *
     * @throws IllegalStateException If both patterns define the same key with different values.
     * @throws RoutePatternException If both patterns define a parameter with the same name.
     */
    public static RoutePattern combine(final RoutePattern left, final RoutePattern right) {
        if (left == null) {
            throw RouteForgeMessages.MESSAGES.argumentCannotBeNull("left");
        }
        if (right == null) {
            throw RouteForgeMessages.MESSAGES.argumentCannotBeNull("right");
        }

        final String rawText = combineRawText(left.getRawText(), right.getRawText());

        final List<RoutePatternParameterPart> parameters = combineLists(
                left.getParameters(),
                right.getParameters(),
                checkDuplicateParameters(rawText)
        );
        final List<RoutePatternPathSegment> pathSegments = combineLists(
                left.getPathSegments(),
                right.getPathSegments(),
                null
        );

        final Map<String, Object> defaults = combineDictionaries(
                left.getDefaults(), right.getDefaults(), rawText, DEFAULTS
        );
        final Map<String, Object> requiredValues = combineDictionaries(
                left.getRequiredValues(), right.getRequiredValues(), rawText, REQUIRED_VALUES
        );
        // policy lists for the same name must be equal, they are never concatenated
        final Map<String, List<RoutePatternParameterPolicyReference>> parameterPolicies = combineDictionaries(
                left.getParameterPolicies(), right.getParameterPolicies(), rawText, PARAMETER_POLICIES
        );

        RouteForgeLogger.PATTERN_LOGGER.combinedRoutePatterns(left.getRawText(), right.getRawText(), rawText);
        return new RoutePattern(rawText, defaults, parameterPolicies, requiredValues, parameters, pathSegments);
    }

    private static String combineRawText(final String left, final String right) {
        final String leftText = left == null ? "" : left;
        final String rightText = right == null ? "" : right;

        int end = leftText.length();
        while (end > 0 && leftText.charAt(end - 1) == RoutePattern.SEPARATOR) {
            --end;
        }
        int start = 0;
        while (start < rightText.length() && rightText.charAt(start) == RoutePattern.SEPARATOR) {
            ++start;
        }
        return leftText.substring(0, end) + RoutePattern.SEPARATOR + rightText.substring(start);
    }

    private static <T> List<T> combineLists(
            final List<T> leftList,
            final List<T> rightList,
            final Consumer<T> check
    ) {
        if (leftList.isEmpty()) {
            return rightList;
        }
        if (rightList.isEmpty()) {
            return leftList;
        }

        final List<T> combinedList = new ArrayList<>(leftList.size() + rightList.size());
        for (final T item : leftList) {
            if (check != null) {
                check.accept(item);
            }
            combinedList.add(item);
        }
        for (final T item : rightList) {
            if (check != null) {
                check.accept(item);
            }
            combinedList.add(item);
        }
        return Collections.unmodifiableList(combinedList);
    }

    private static <V> Map<String, V> combineDictionaries(
            final Map<String, V> leftDictionary,
            final Map<String, V> rightDictionary,
            final String rawText,
            final String dictionaryName
    ) {
        if (leftDictionary.isEmpty()) {
            return rightDictionary;
        }
        if (rightDictionary.isEmpty()) {
            return leftDictionary;
        }

        final Map<String, V> combinedDictionary = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        combinedDictionary.putAll(leftDictionary);
        for (final Map.Entry<String, V> entry : rightDictionary.entrySet()) {
            final String key = entry.getKey();
            if (combinedDictionary.containsKey(key)) {
                final V leftValue = combinedDictionary.get(key);
                if (!Objects.equals(leftValue, entry.getValue())) {
                    throw RouteForgeMessages.MESSAGES.repeatedDictionaryEntry(
                            rawText, dictionaryName, key, leftValue, entry.getValue()
                    );
                }
            } else {
                combinedDictionary.put(key, entry.getValue());
            }
        }
        return Collections.unmodifiableMap(combinedDictionary);
    }

    private static Consumer<RoutePatternParameterPart> checkDuplicateParameters(final String rawText) {
        final Set<String> parameterNameSet = newNameSet();
        return parameterPart -> {
            if (!parameterNameSet.add(parameterPart.getName())) {
                throw new RoutePatternException(
                        rawText, RouteForgeMessages.MESSAGES.repeatedParameter(rawText, parameterPart.getName())
                );
            }
        };
    }

    //</editor-fold>
    //
    //<editor-fold defaultstate="collapsed" desc="Segments and parts">
    public static RoutePatternPathSegment segment(final RoutePatternPart... parts) {
        if (parts == null) {
            throw RouteForgeMessages.MESSAGES.argumentCannotBeNull("parts");
        }
        return segment(Arrays.asList(parts));
    }

    /**
     * Creates a segment from a sequence of parts. The arrangement of the parts is not validated.
     *
     * @param parts The parts. Must contain at least one part.
     *
     * @return The segment.
     */
    public static RoutePatternPathSegment segment(final Iterable<RoutePatternPart> parts) {
        if (parts == null) {
            throw RouteForgeMessages.MESSAGES.argumentCannotBeNull("parts");
        }
        final List<RoutePatternPart> list = new ArrayList<>();
        for (final RoutePatternPart part : parts) {
            if (part == null) {
                throw RouteForgeMessages.MESSAGES.argumentCannotBeNull("parts");
            }
            list.add(part);
        }
        if (list.isEmpty()) {
            throw RouteForgeMessages.MESSAGES.argumentNullOrEmpty("parts");
        }
        return new RoutePatternPathSegment(list);
    }

    public static RoutePatternLiteralPart literalPart(final String content) {
        if (content == null || content.isEmpty()) {
            throw RouteForgeMessages.MESSAGES.argumentNullOrEmpty("content");
        }
        if (content.indexOf('?') >= 0) {
            throw RouteForgeMessages.MESSAGES.invalidLiteral(content);
        }
        return new RoutePatternLiteralPart(content);
    }

    public static RoutePatternSeparatorPart separatorPart(final String content) {
        if (content == null || content.isEmpty()) {
            throw RouteForgeMessages.MESSAGES.argumentNullOrEmpty("content");
        }
        return new RoutePatternSeparatorPart(content);
    }

    public static RoutePatternParameterPart parameterPart(final String parameterName) {
        return parameterPart(parameterName, null, RoutePatternParameterKind.STANDARD, Collections.emptyList(), DEFAULT_ENCODE_SLASHES);
    }

    public static RoutePatternParameterPart parameterPart(final String parameterName, final Object defaultValue) {
        return parameterPart(parameterName, defaultValue, RoutePatternParameterKind.STANDARD, Collections.emptyList(), DEFAULT_ENCODE_SLASHES);
    }

    public static RoutePatternParameterPart parameterPart(
            final String parameterName,
            final Object defaultValue,
            final RoutePatternParameterKind parameterKind
    ) {
        return parameterPart(parameterName, defaultValue, parameterKind, Collections.emptyList(), DEFAULT_ENCODE_SLASHES);
    }

    public static RoutePatternParameterPart parameterPart(
            final String parameterName,
            final Object defaultValue,
            final RoutePatternParameterKind parameterKind,
            final RoutePatternParameterPolicyReference... parameterPolicies
    ) {
        if (parameterPolicies == null) {
            throw RouteForgeMessages.MESSAGES.argumentCannotBeNull("parameterPolicies");
        }
        return parameterPart(parameterName, defaultValue, parameterKind, Arrays.asList(parameterPolicies), DEFAULT_ENCODE_SLASHES);
    }

    public static RoutePatternParameterPart parameterPart(
            final String parameterName,
            final Object defaultValue,
            final RoutePatternParameterKind parameterKind,
            final Iterable<RoutePatternParameterPolicyReference> parameterPolicies
    ) {
        return parameterPart(parameterName, defaultValue, parameterKind, parameterPolicies, DEFAULT_ENCODE_SLASHES);
    }

    /**
     * Creates a parameter part.
     *
     * @param parameterName     The name of the parameter. Must not contain '{', '}', '/', '?' or '*'.
     * @param defaultValue      The default value. May be {@code null}. Must be {@code null} for optional parameters.
     * @param parameterKind     The kind of parameter.
     * @param parameterPolicies The policies of the parameter.
     * @param encodeSlashes     True if a '/' in the value of the parameter is percent-encoded when a path is generated.
     *
     * @return The parameter part.
     */
    public static RoutePatternParameterPart parameterPart(
            final String parameterName,
            final Object defaultValue,
            final RoutePatternParameterKind parameterKind,
            final Iterable<RoutePatternParameterPolicyReference> parameterPolicies,
            final boolean encodeSlashes
    ) {
        if (parameterName == null || parameterName.isEmpty()) {
            throw RouteForgeMessages.MESSAGES.argumentNullOrEmpty("parameterName");
        }
        if (!isValidParameterName(parameterName)) {
            throw RouteForgeMessages.MESSAGES.invalidParameterName(parameterName);
        }
        if (parameterKind == null) {
            throw RouteForgeMessages.MESSAGES.argumentCannotBeNull("parameterKind");
        }
        if (defaultValue != null && parameterKind == RoutePatternParameterKind.OPTIONAL) {
            throw RouteForgeMessages.MESSAGES.optionalParameterWithDefault(parameterName);
        }
        if (parameterPolicies == null) {
            throw RouteForgeMessages.MESSAGES.argumentCannotBeNull("parameterPolicies");
        }

        final List<RoutePatternParameterPolicyReference> policies = new ArrayList<>();
        for (final RoutePatternParameterPolicyReference policy : parameterPolicies) {
            if (policy == null) {
                throw RouteForgeMessages.MESSAGES.argumentCannotBeNull("parameterPolicies");
            }
            policies.add(policy);
        }
        return new RoutePatternParameterPart(parameterName, defaultValue, parameterKind, policies, encodeSlashes);
    }

    private static boolean isValidParameterName(final String parameterName) {
        for (int i = 0; i < parameterName.length(); ++i) {
            final char c = parameterName.charAt(i);
            for (final char invalid : INVALID_PARAMETER_NAME_CHARS) {
                if (c == invalid) {
                    return false;
                }
            }
        }
        return true;
    }

    //</editor-fold>
    //
    //<editor-fold defaultstate="collapsed" desc="Policy references">
    /**
     * Creates a policy reference from a constraint object.
     *
     * @param constraint A {@link RouteConstraint}, or a {@link String} that is converted into a {@link RegexRouteConstraint}
     *                   that must match the entire value.
     *
     * @return The policy reference.
     *
     * @throws IllegalStateException If {@code constraint} is neither a {@link RouteConstraint} nor a {@link String}.
     */
    public static RoutePatternParameterPolicyReference constraint(final Object constraint) {
        return constraintCore(constraint);
    }

    public static RoutePatternParameterPolicyReference constraint(final RouteConstraint constraint) {
        if (constraint == null) {
            throw RouteForgeMessages.MESSAGES.argumentCannotBeNull("constraint");
        }
        return new RoutePatternParameterPolicyReference(constraint);
    }

    /**
     * Creates a deferred policy reference that is resolved by name when requests are routed.
     *
     * @param constraint The textual reference, for example {@code int} or {@code min(1)}.
     *
     * @return The policy reference.
     */
    public static RoutePatternParameterPolicyReference constraint(final String constraint) {
        if (constraint == null || constraint.isEmpty()) {
            throw RouteForgeMessages.MESSAGES.argumentNullOrEmpty("constraint");
        }
        return new RoutePatternParameterPolicyReference(constraint);
    }

    public static RoutePatternParameterPolicyReference parameterPolicy(final ParameterPolicy parameterPolicy) {
        if (parameterPolicy == null) {
            throw RouteForgeMessages.MESSAGES.argumentCannotBeNull("parameterPolicy");
        }
        return new RoutePatternParameterPolicyReference(parameterPolicy);
    }

    public static RoutePatternParameterPolicyReference parameterPolicy(final String parameterPolicy) {
        if (parameterPolicy == null || parameterPolicy.isEmpty()) {
            throw RouteForgeMessages.MESSAGES.argumentNullOrEmpty("parameterPolicy");
        }
        return new RoutePatternParameterPolicyReference(parameterPolicy);
    }
    //</editor-fold>
}
