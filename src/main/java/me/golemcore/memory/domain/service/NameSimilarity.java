package me.golemcore.memory.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

/**
 * Jaro-Winkler string similarity over Unicode code points, used for fuzzy
 * entity name matching.
 */
public final class NameSimilarity {

    private static final double PREFIX_SCALE = 0.1;
    private static final int MAX_PREFIX = 4;

    private NameSimilarity() {
    }

    /**
     * @return similarity in [0, 1], 1 for identical strings
     */
    public static double jaroWinkler(String first, String second) {
        if (first.equals(second)) {
            return 1.0;
        }
        int[] s1 = first.codePoints().toArray();
        int[] s2 = second.codePoints().toArray();
        if (s1.length == 0 || s2.length == 0) {
            return 0.0;
        }

        int matchDistance = Math.max(0, Math.max(s1.length, s2.length) / 2 - 1);
        boolean[] s1Matches = new boolean[s1.length];
        boolean[] s2Matches = new boolean[s2.length];
        int matches = 0;
        for (int i = 0; i < s1.length; i++) {
            int start = Math.max(0, i - matchDistance);
            int end = Math.min(i + matchDistance + 1, s2.length);
            for (int j = start; j < end; j++) {
                if (!s2Matches[j] && s1[i] == s2[j]) {
                    s1Matches[i] = true;
                    s2Matches[j] = true;
                    matches++;
                    break;
                }
            }
        }
        if (matches == 0) {
            return 0.0;
        }

        int transpositions = 0;
        int k = 0;
        for (int i = 0; i < s1.length; i++) {
            if (s1Matches[i]) {
                while (!s2Matches[k]) {
                    k++;
                }
                if (s1[i] != s2[k]) {
                    transpositions++;
                }
                k++;
            }
        }

        double m = matches;
        double jaro = (m / s1.length + m / s2.length + (m - transpositions / 2.0) / m) / 3.0;

        int prefix = 0;
        for (int i = 0; i < Math.min(MAX_PREFIX, Math.min(s1.length, s2.length)); i++) {
            if (s1[i] != s2[i]) {
                break;
            }
            prefix++;
        }
        return jaro + prefix * PREFIX_SCALE * (1.0 - jaro);
    }
}
