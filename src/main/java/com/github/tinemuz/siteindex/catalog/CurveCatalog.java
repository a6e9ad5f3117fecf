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

import com.github.tinemuz.siteindex.curve.Curve;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry of the curves the engine knows, read from {@value #RESOURCE}.
 *
 * <p>A catalog is immutable once built. The shared instance is loaded lazily on
 * first use; call {@link #preload()} to pay the cost up front. Curves named in
 * {@link EngineSettings#DISABLED_CURVES} resolve like unknown indices.</p>
 */
public final class CurveCatalog {
    private static final Logger log = LoggerFactory.getLogger(CurveCatalog.class);

    public static final String RESOURCE = "si-curves.txt";

    private static volatile CurveCatalog shared;

    private final Map<Curve, CurveInfo> entries;
    private final Set<Curve> disabled;

    private CurveCatalog(Map<Curve, CurveInfo> entries, Set<Curve> disabled) {
        this.entries = Collections.unmodifiableMap(entries);
        this.disabled = Collections.unmodifiableSet(disabled);
    }

    /** The shared catalog, built from the classpath on first call. */
    public static CurveCatalog defaults() {
        CurveCatalog c = shared;
        return c != null ? c : ensureLoaded();
    }

    /** Eagerly load the shared catalog. */
    public static void preload() {
        defaults();
    }

    private static synchronized CurveCatalog ensureLoaded() {
        if (shared == null) {
            shared = load(RESOURCE, EngineSettings.load());
        }
        return shared;
    }

    /** Build a catalog from a classpath resource. */
    public static CurveCatalog load(String resource, EngineSettings settings) {
        InputStream in = CurveCatalog.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            log.error("Curve table '{}' not found on classpath", resource);
            throw new IllegalStateException("Curve table '" + resource + "' not found on classpath");
        }
        try (BufferedReader br = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            return parse(br, settings);
        } catch (IOException e) {
            log.error("Failed to read curve table '{}'", resource, e);
            throw new IllegalStateException("Failed to read curve table '" + resource + "'", e);
        } catch (Exception e) {
            log.error("Failed to parse curve table '{}'", resource, e);
            throw new IllegalStateException("Failed to parse curve table '" + resource + "'", e);
        }
    }

    /**
     * Parse a curve table. Every row must agree with {@link Curve} on index and
     * code, and every curve must have a row.
     */
    static CurveCatalog parse(BufferedReader br, EngineSettings settings) throws IOException {
        Map<Curve, CurveInfo> entries = new EnumMap<>(Curve.class);
        String line;
        int lineNo = 0;
        while ((line = br.readLine()) != null) {
            lineNo++;
            line = line.trim();
            if (line.isEmpty() || line.startsWith("#")) continue;

            String[] parts = line.split("\\s+", 6);
            if (parts.length < 6) {
                throw new IllegalArgumentException("line " + lineNo + ": expected 6 columns");
            }
            int index = Integer.parseInt(parts[0]);
            Optional<Curve> known = Curve.fromIndex(index);
            if (known.isEmpty()) {
                throw new IllegalArgumentException("line " + lineNo + ": no curve with index " + index);
            }
            Curve curve = known.get();
            if (!curve.name().equals(parts[1])) {
                throw new IllegalArgumentException("line " + lineNo + ": index " + index
                        + " is " + curve.name() + ", not " + parts[1]);
            }
            double bh = Double.parseDouble(parts[3]);
            if (bh != curve.breastHeight()) {
                throw new IllegalArgumentException("line " + lineNo + ": breast height " + bh
                        + " disagrees with " + curve.name());
            }
            Set<CurveInfo.Equation> eq = CurveInfo.Equation.decode(Integer.parseInt(parts[4]));
            if (eq.contains(CurveInfo.Equation.GROWTH_INTERCEPT) != curve.isGrowthIntercept()) {
                throw new IllegalArgumentException("line " + lineNo + ": growth intercept flag disagrees with "
                        + curve.name());
            }
            if (entries.put(curve, new CurveInfo(curve, parts[2], bh, eq, parts[5].trim())) != null) {
                throw new IllegalArgumentException("line " + lineNo + ": duplicate curve " + curve.name());
            }
        }
        if (entries.size() != Curve.values().length) {
            Set<Curve> missing = EnumSet.allOf(Curve.class);
            missing.removeAll(entries.keySet());
            throw new IllegalArgumentException("curve table lacks " + missing);
        }

        Set<Curve> disabled = EnumSet.noneOf(Curve.class);
        for (String code : settings.disabledCurves()) {
            Optional<Curve> curve = entries.keySet().stream().filter(c -> c.name().equals(code)).findFirst();
            if (curve.isPresent()) {
                disabled.add(curve.get());
                log.warn("Curve {} disabled by configuration", code);
            } else {
                log.warn("Ignoring unknown curve code '{}' in {}", code, EngineSettings.DISABLED_CURVES);
            }
        }
        log.debug("Loaded {} site index curves, {} disabled", entries.size(), disabled.size());
        return new CurveCatalog(entries, disabled);
    }

    /** The enabled curve with this index, if any. */
    public Optional<Curve> resolve(int index) {
        return Curve.fromIndex(index).filter(this::isEnabled);
    }

    public boolean isEnabled(Curve curve) {
        return !disabled.contains(curve);
    }

    public CurveInfo info(Curve curve) {
        return entries.get(curve);
    }

    /** All curves, enabled or not, in index order. */
    public Collection<CurveInfo> all() {
        return entries.values();
    }

    public Set<Curve> disabledCurves() {
        return disabled;
    }

    public int size() {
        return entries.size();
    }
}
