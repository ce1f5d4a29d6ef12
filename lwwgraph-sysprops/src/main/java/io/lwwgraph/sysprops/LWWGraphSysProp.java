/*
 * Copyright (c) 2024. The LWWGraph Authors. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *    http://www.apache.org/licenses/LICENSE-2.0
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and limitations under the License.
 */

package io.lwwgraph.sysprops;

import com.google.common.base.Strings;
import io.lwwgraph.sysprops.parser.PropParser;
import io.lwwgraph.sysprops.parser.SysPropParseException;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;

/**
 * A typed system property. Subclasses are singletons exposing a {@code public static final INSTANCE}.
 *
 * <p>The raw value is trimmed and lower-cased before parsing. A blank or unparsable value resolves to the
 * default.
 *
 * @param <T> the parsed value type
 * @param <P> the parser type
 */
@Slf4j
public abstract class LWWGraphSysProp<T, P extends PropParser<T>> {
    private final String propKey;
    private final P parser;
    private final T defaultValue;
    private volatile T value;

    protected LWWGraphSysProp(String propKey, T defaultValue, P parser) {
        this.propKey = propKey;
        this.defaultValue = defaultValue;
        this.parser = parser;
        resolve();
    }

    /**
     * Re-read the property from the system properties.
     */
    public final void resolve() {
        value = parse(Strings.nullToEmpty(System.getProperty(propKey)).trim().toLowerCase(Locale.ROOT));
    }

    private T parse(String raw) {
        if (raw.isEmpty()) {
            return defaultValue;
        }
        try {
            return parser.parse(raw);
        } catch (SysPropParseException e) {
            log.warn("Ignore system property {}={}, use default {}: {}", propKey, raw, defaultValue, e.getMessage());
            return defaultValue;
        }
    }

    public final String propKey() {
        return propKey;
    }

    public final T defaultValue() {
        return defaultValue;
    }

    public final T get() {
        return value;
    }
}
