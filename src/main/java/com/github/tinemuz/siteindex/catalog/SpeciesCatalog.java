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

import com.github.tinemuz.siteindex.ErrorKind;
import com.github.tinemuz.siteindex.SiteIndexResult;
import com.github.tinemuz.siteindex.curve.Curve;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Species defaults, site class tables and between-species site index
 * conversions, read from {@value #SPECIES_RESOURCE} and
 * {@value #CONVERSIONS_RESOURCE}.
 *
 * <p>Species codes are matched ignoring case and surrounding blanks.</p>
 */
public final class SpeciesCatalog {
    private static final Logger log = LoggerFactory.getLogger(SpeciesCatalog.class);

    public static final String SPECIES_RESOURCE = "si-species.txt";
    public static final String CONVERSIONS_RESOURCE = "si-conversions.txt";

    private static volatile SpeciesCatalog shared;

    private final Map<String, Species> species;
    private final Map<String, Conversion> conversions;

    /** si(to) = a + b * si(from) */
    private record Conversion(double a, double b) {}

    private SpeciesCatalog(Map<String, Species> species, Map<String, Conversion> conversions) {
        this.species = Collections.unmodifiableMap(species);
        this.conversions = Collections.unmodifiableMap(conversions);
    }

    public static SpeciesCatalog defaults() {
        SpeciesCatalog c = shared;
        return c != null ? c : ensureLoaded();
    }

    public static void preload() {
        defaults();
    }

    private static synchronized SpeciesCatalog ensureLoaded() {
        if (shared == null) {
            Map<String, Species> sp = read(SPECIES_RESOURCE, SpeciesCatalog::parseSpecies);
            Map<String, Conversion> conv = read(CONVERSIONS_RESOURCE, br -> parseConversions(br, sp));
            log.debug("Loaded {} species and {} site index conversions", sp.size(), conv.size());
            shared = new SpeciesCatalog(sp, conv);
        }
        return shared;
    }

    @FunctionalInterface
    private interface TableParser<T> {
        T parse(BufferedReader br) throws IOException;
    }

    private static <T> T read(String resource, TableParser<T> parser) {
        InputStream in = SpeciesCatalog.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            log.error("Species table '{}' not found on classpath", resource);
            throw new IllegalStateException("Species table '" + resource + "' not found on classpath");
        }
        try (BufferedReader br = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            return parser.parse(br);
        } catch (IOException e) {
            log.error("Failed to read species table '{}'", resource, e);
            throw new IllegalStateException("Failed to read species table '" + resource + "'", e);
        } catch (Exception e) {
            log.error("Failed to parse species table '{}'", resource, e);
            throw new IllegalStateException("Failed to parse species table '" + resource + "'", e);
        }
    }

    static Map<String, Species> parseSpecies(BufferedReader br) throws IOException {
        Map<String, Species> out = new LinkedHashMap<>();
        String line;
        int lineNo = 0;
        while ((line = br.readLine()) != null) {
            lineNo++;
            line = line.trim();
            if (line.isEmpty() || line.startsWith("#")) continue;

            String[] parts = line.split("\\|");
            if (parts.length < 6 || parts.length > 7) {
                throw new IllegalArgumentException("line " + lineNo + ": expected 6 or 7 columns");
            }
            String code = key(parts[0]);
            Map<Establishment, Curve> byEstablishment = new EnumMap<>(Establishment.class);
            if (parts.length == 7) {
                for (String pair : parts[6].trim().split(",")) {
                    String[] kv = pair.split("=");
                    if (kv.length != 2) {
                        throw new IllegalArgumentException("line " + lineNo + ": bad establishment entry '" + pair + "'");
                    }
                    byEstablishment.put(Establishment.valueOf(kv[0].trim().toUpperCase(Locale.ROOT)),
                            Curve.valueOf(kv[1].trim()));
                }
            }
            Species s = new Species(code, parts[1].trim(),
                    curveOrNull(parts[2]), curveOrNull(parts[3]),
                    classesOrNull(parts[4], lineNo), classesOrNull(parts[5], lineNo),
                    byEstablishment);
            if (out.put(code, s) != null) {
                throw new IllegalArgumentException("line " + lineNo + ": duplicate species " + code);
            }
        }
        return out;
    }

    static Map<String, Conversion> parseConversions(BufferedReader br, Map<String, Species> known) throws IOException {
        Map<String, Conversion> out = new HashMap<>();
        String line;
        int lineNo = 0;
        while ((line = br.readLine()) != null) {
            lineNo++;
            line = line.trim();
            if (line.isEmpty() || line.startsWith("#")) continue;

            String[] parts = line.split("\\s+");
            if (parts.length != 4) {
                throw new IllegalArgumentException("line " + lineNo + ": expected 4 columns");
            }
            String from = key(parts[0]);
            String to = key(parts[1]);
            if (!known.containsKey(from) || !known.containsKey(to)) {
                throw new IllegalArgumentException("line " + lineNo + ": unknown species in " + from + " -> " + to);
            }
            out.put(from + ">" + to, new Conversion(Double.parseDouble(parts[2]), Double.parseDouble(parts[3])));
        }
        return out;
    }

    private static String key(String code) {
        return code.trim().toUpperCase(Locale.ROOT);
    }

    private static Curve curveOrNull(String column) {
        String v = column.trim();
        return v.equals("-") ? null : Curve.valueOf(v);
    }

    private static double[] classesOrNull(String column, int lineNo) {
        String v = column.trim();
        if (v.equals("-")) {
            return null;
        }
        String[] parts = v.split("/");
        if (parts.length != SiteClass.values().length) {
            throw new IllegalArgumentException("line " + lineNo + ": expected G/M/P/L values, got '" + v + "'");
        }
        double[] out = new double[parts.length];
        for (int i = 0; i < parts.length; i++) {
            out[i] = Double.parseDouble(parts[i]);
        }
        return out;
    }

    public Optional<Species> find(String code) {
        return code == null ? Optional.empty() : Optional.ofNullable(species.get(key(code)));
    }

    public Collection<Species> all() {
        return species.values();
    }

    /**
     * Typical site index for a species and site class.
     *
     * @param fiz FIZ code, consulted only for species whose table splits coast and interior
     */
    public SiteIndexResult classToIndex(String speciesCode, char siteClass, char fiz) {
        Optional<Species> sp = find(speciesCode);
        if (sp.isEmpty()) {
            return SiteIndexResult.error(ErrorKind.UNKNOWN_SPECIES_CODE);
        }
        Optional<SiteClass> sc = SiteClass.of(siteClass);
        if (sc.isEmpty()) {
            return SiteIndexResult.error(ErrorKind.UNKNOWN_SITE_CLASS);
        }
        return sp.get().siteIndexFor(sc.get(), FizZone.of(fiz));
    }

    /**
     * Convert a site index measured on one species to the equivalent on another.
     * Pairs without a fitted conversion give {@link ErrorKind#NO_CONVERGENCE}.
     */
    public SiteIndexResult siteIndexToSiteIndex(String fromCode, double siteIndex, String toCode) {
        Optional<Species> from = find(fromCode);
        Optional<Species> to = find(toCode);
        if (from.isEmpty() || to.isEmpty()) {
            return SiteIndexResult.error(ErrorKind.UNKNOWN_SPECIES_CODE);
        }
        Conversion c = conversions.get(from.get().code() + ">" + to.get().code());
        if (c == null) {
            return SiteIndexResult.error(ErrorKind.NO_CONVERGENCE);
        }
        return SiteIndexResult.of(c.a() + c.b() * siteIndex);
    }

    /** Whether a fitted conversion exists between the two species. */
    public boolean converts(String fromCode, String toCode) {
        return conversions.containsKey(key(fromCode) + ">" + key(toCode));
    }
}
