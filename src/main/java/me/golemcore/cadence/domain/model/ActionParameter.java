package me.golemcore.cadence.domain.model;

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

import lombok.Value;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Declared shape of a single action parameter: its name, value type and
 * whether the planner must supply it.
 */
@Value
public class ActionParameter {

    String name;
    ParameterType type;
    boolean required;

    public static ActionParameter required(String name, ParameterType type) {
        return new ActionParameter(name, type, true);
    }

    public static ActionParameter optional(String name, ParameterType type) {
        return new ActionParameter(name, type, false);
    }

    /**
     * Value types a parameter may declare. Integers are accepted where numbers
     * are declared; whole-valued numbers are accepted where integers are.
     */
    public enum ParameterType {
        STRING, INTEGER, NUMBER, BOOLEAN, STRING_LIST;

        public boolean accepts(Object value) {
            if (value == null) {
                return true;
            }
            return switch (this) {
            case STRING -> value instanceof String;
            case INTEGER -> value instanceof Integer || value instanceof Long
                    || (value instanceof Number number && number.doubleValue() == Math.rint(number.doubleValue()));
            case NUMBER -> value instanceof Number;
            case BOOLEAN -> value instanceof Boolean;
            case STRING_LIST -> value instanceof List<?> list && list.stream().allMatch(String.class::isInstance);
            };
        }

        /**
         * Returns the value in this type, converting text the model sent for a
         * number or boolean (e.g. {@code "10"} for an integer). Empty when the
         * value cannot be used.
         */
        public Optional<Object> coerce(Object value) {
            if (accepts(value)) {
                return Optional.ofNullable(value);
            }
            if (!(value instanceof String text) || text.isBlank()) {
                return Optional.empty();
            }
            String trimmed = text.trim();
            return switch (this) {
            case INTEGER -> parseWhole(trimmed);
            case NUMBER -> parseNumber(trimmed);
            case BOOLEAN -> parseBoolean(trimmed);
            case STRING, STRING_LIST -> Optional.empty();
            };
        }

        private static Optional<Object> parseWhole(String text) {
            if (!text.matches("[+-]?\\d{1,18}")) {
                return Optional.empty();
            }
            long parsed = Long.parseLong(text);
            if (parsed >= Integer.MIN_VALUE && parsed <= Integer.MAX_VALUE) {
                return Optional.of((int) parsed);
            }
            return Optional.of(parsed);
        }

        private static Optional<Object> parseNumber(String text) {
            if (!text.matches("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?")) {
                return Optional.empty();
            }
            return Optional.of(Double.parseDouble(text));
        }

        private static Optional<Object> parseBoolean(String text) {
            if ("true".equalsIgnoreCase(text)) {
                return Optional.of(Boolean.TRUE);
            }
            if ("false".equalsIgnoreCase(text)) {
                return Optional.of(Boolean.FALSE);
            }
            return Optional.empty();
        }

        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
