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
package com.github.tinemuz.siteindex.curve;

import static com.github.tinemuz.siteindex.curve.Curve.*;

import com.github.tinemuz.siteindex.AgeType;
import com.github.tinemuz.siteindex.ErrorKind;
import com.github.tinemuz.siteindex.SiteIndexResult;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Converts between total age and breast-height age.
 *
 * <p>Curves whose equations count breast-height age from half a year before
 * the tree reaches breast height use an offset of {@code y2bh - 0.5}; all
 * others use {@code y2bh}. Converted ages never go below 0.</p>
 */
public final class AgeConverter {
    private static final Set<Curve> HALF_YEAR_OFFSET = EnumSet.of(
            ACB_HUANGAC, ACT_THROWERAC, AT_NIGH, BA_KURUCZ82AC, BA_NIGH,
            BL_CHENAC, BP_CURTISAC, CWC_KURUCZAC, CWI_NIGH, DR_NIGH,
            EP_NIGH, FDC_BRUCENIGH, FDC_BRUCEAC, FDC_NIGHTA, FDI_THROWERAC,
            HM_MEANSAC, HWC_WILEYAC, HWI_NIGH, LW_NIGH, PJ_HUANG,
            PJ_HUANGAC, PLI_NIGHTA2004, PLI_NIGHTA98, PLI_THROWNIGH, PLI_THROWER,
            PW_CURTISAC, PY_HANNAC, PY_NIGH, SB_NIGH, SE_CHENAC,
            SE_NIGHTA, SW_GOUDIE_NATAC, SW_GOUDIE_PLAAC, SW_GOUDNIGH, SW_NIGHTA2004,
            SW_NIGHTA, SS_NIGH);

    private AgeConverter() {}

    /**
     * Convert {@code age} from {@code from} to {@code to}.
     *
     * @return the converted age, or {@link ErrorKind#UNSUPPORTED_AGE_TYPE_COMBINATION}
     *         when {@code from == to}
     */
    public static SiteIndexResult convert(Curve curve, double age, AgeType from, AgeType to, double y2bh) {
        Objects.requireNonNull(curve, "curve");
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        if (from == to) {
            return SiteIndexResult.error(ErrorKind.UNSUPPORTED_AGE_TYPE_COMBINATION);
        }
        double offset = usesHalfYearOffset(curve) ? y2bh - 0.5 : y2bh;
        double converted = from == AgeType.BREAST ? age + offset : age - offset;
        return SiteIndexResult.of(Math.max(converted, 0.0));
    }

    static boolean usesHalfYearOffset(Curve curve) {
        return HALF_YEAR_OFFSET.contains(curve);
    }
}
