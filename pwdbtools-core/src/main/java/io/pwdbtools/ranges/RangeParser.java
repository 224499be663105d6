/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.pwdbtools.ranges;

import java.util.List;
import java.util.TreeSet;

/**
 * Parser for compact index range expressions such as {@code 0,2-4,7,10-12}.
 *
 * <p>Each comma-separated token is either a single non-negative integer or an
 * inclusive range {@code lo-hi}. The result is ascending and free of duplicates,
 * even when ranges overlap.</p>
 *
 * <p>A single range may span at most {@link #MAX_SPAN} indices.</p>
 */
public final class RangeParser {

    /// the largest number of indices one {@code lo-hi} token may expand to
    public static final int MAX_SPAN = 1_000_000;

    private RangeParser() {}

    /**
     * Parses a range expression.
     *
     * @param expression the expression, may be null or blank
     * @return the ascending distinct indices, empty for blank input
     * @throws MalformedRangeException naming the first offending token
     */
    public static List<Integer> parse(String expression) {
        if (expression == null || expression.isBlank()) {
            return List.of();
        }

        TreeSet<Integer> indices = new TreeSet<>();
        for (String rawToken : expression.split(",", -1)) {
            String token = rawToken.trim();
            if (token.isEmpty()) {
                throw new MalformedRangeException(rawToken, "empty token");
            }
            int dash = token.indexOf('-');
            if (dash < 0) {
                indices.add(parseIndex(token, token));
                continue;
            }
            if (dash == 0) {
                throw new MalformedRangeException(token, "negative values are not allowed");
            }
            int lo = parseIndex(token.substring(0, dash).trim(), token);
            int hi = parseIndex(token.substring(dash + 1).trim(), token);
            if (lo > hi) {
                throw new MalformedRangeException(token,
                    "range start " + lo + " is greater than range end " + hi);
            }
            long span = (long) hi - lo + 1;
            if (span > MAX_SPAN) {
                throw new MalformedRangeException(token,
                    "range covers " + span + " indices, at most " + MAX_SPAN + " are allowed");
            }
            for (long i = lo; i <= hi; i++) {
                indices.add((int) i);
            }
        }
        return List.copyOf(indices);
    }

    private static int parseIndex(String part, String token) {
        if (part.isEmpty()) {
            throw new MalformedRangeException(token, "expected 'start-end' or a single index");
        }
        try {
            int value = Integer.parseInt(part);
            if (value < 0) {
                throw new MalformedRangeException(token, "negative values are not allowed");
            }
            return value;
        } catch (NumberFormatException e) {
            throw new MalformedRangeException(token, "'" + part + "' is not an integer", e);
        }
    }
}
