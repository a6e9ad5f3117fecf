/*
 * MIT License
 *
 * Copyright (c) 2025 tinemuz
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package com.github.tinemuz.siteindex.catalog;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Properties;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Engine settings from the classpath file {@value #RESOURCE}.
 *
 * <p>A system property with the same key as a file entry wins over the file.
 * A missing file means default settings.</p>
 */
public final class EngineSettings {
    private static final Logger log = LoggerFactory.getLogger(EngineSettings.class);

    public static final String RESOURCE = "siteindex.properties";
    /** Comma-separated curve codes that behave as unknown curves. */
    public static final String DISABLED_CURVES = "siteindex.curves.disabled";

    private final Set<String> disabledCurves;

    private EngineSettings(Set<String> disabledCurves) {
        this.disabledCurves = Collections.unmodifiableSet(disabledCurves);
    }

    /** Settings with nothing disabled. */
    public static EngineSettings defaults() {
        return new EngineSettings(new LinkedHashSet<>());
    }

    /** Read {@value #RESOURCE} from the classpath, then apply system property overrides. */
    public static EngineSettings load() {
        Properties props = new Properties();
        InputStream in = EngineSettings.class.getClassLoader().getResourceAsStream(RESOURCE);
        if (in == null) {
            log.debug("No {} on classpath, using defaults", RESOURCE);
        } else {
            try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
                props.load(reader);
            } catch (IOException e) {
                log.error("Failed to read settings file '{}'", RESOURCE, e);
                throw new IllegalStateException("Failed to read settings file '" + RESOURCE + "'", e);
            }
        }
        String override = System.getProperty(DISABLED_CURVES);
        if (override != null) {
            props.setProperty(DISABLED_CURVES, override);
        }
        return fromProperties(props);
    }

    public static EngineSettings fromProperties(Properties props) {
        String raw = props.getProperty(DISABLED_CURVES, "");
        Set<String> codes = new LinkedHashSet<>();
        Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(s -> s.toUpperCase(Locale.ROOT))
                .forEach(codes::add);
        return new EngineSettings(codes);
    }

    /** Upper-case curve codes, in file order. */
    public Set<String> disabledCurves() {
        return disabledCurves;
    }
}
