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

import java.util.Optional;

/**
 * Fitted height-age and growth-intercept curves, one constant per stable
 * curve index.
 *
 * <p>The constant name is the species code followed by the author of the
 * published equation. An {@code AC} suffix marks the variant whose origin is
 * shifted half a year so that breast-height age 0.5 falls at breast height.
 * A {@code GI} suffix marks a growth-intercept curve.</p>
 */
public enum Curve {
    ACB_HUANG(0, 1.3, false),
    ACT_THROWER(1, 1.3, false),
    AT_HUANG(2, 1.3, false),
    AT_CIESZEWSKI(3, 1.3, false),
    AT_GOUDIE(4, 1.3, false),
    BA_DILUCCA(5, 1.3, false),
    BB_KER(6, 1.3, false),
    BA_KURUCZ86(7, 1.3, false),
    BA_KURUCZ82(8, 1.3, false),
    BL_THROWERGI(9, 1.3, true),
    BL_KURUCZ82(10, 1.3, false),
    CWC_KURUCZ(11, 1.3, false),
    CWC_BARKER(12, 1.3, false),
    DR_NIGH(13, 1.3, false),
    DR_HARRING(14, 1.3, false),
    FDC_NIGHGI(15, 1.3, true),
    FDC_BRUCE(16, 1.37, false),
    FDC_COCHRAN(17, 1.37, false),
    FDC_KING(18, 1.37, false),
    FDI_NIGHGI(19, 1.3, true),
    FDI_HUANG_PLA(20, 1.3, false),
    FDI_HUANG_NAT(21, 1.3, false),
    FDI_MILNER(22, 1.37, false),
    FDI_THROWER(23, 1.3, false),
    FDI_VDP_MONT(24, 1.37, false),
    FDI_VDP_WASH(25, 1.37, false),
    FDI_MONS_DF(26, 1.37, false),
    FDI_MONS_GF(27, 1.37, false),
    FDI_MONS_WRC(28, 1.37, false),
    FDI_MONS_WH(29, 1.37, false),
    FDI_MONS_SAF(30, 1.37, false),
    HWC_NIGHGI(31, 1.3, true),
    HWC_FARR(32, 1.37, false),
    HWC_BARKER(33, 1.3, false),
    HWC_WILEY(34, 1.37, false),
    HWC_WILEY_BC(35, 1.37, false),
    HWC_WILEY_MB(36, 1.37, false),
    HWI_NIGH(37, 1.3, false),
    HWI_NIGHGI(38, 1.3, true),
    LW_MILNER(39, 1.37, false),
    PLI_THROWNIGH(40, 1.3, false),
    PLI_NIGHTA98(41, 1.3, false),
    PLI_NIGHGI97(42, 1.3, true),
    PLI_HUANG_PLA(43, 1.3, false),
    PLI_HUANG_NAT(44, 1.3, false),
    PLI_THROWER(45, 1.3, false),
    PLI_MILNER(46, 1.37, false),
    PLI_CIESZEWSKI(47, 1.3, false),
    PLI_GOUDIE_DRY(48, 1.3, false),
    PLI_GOUDIE_WET(49, 1.3, false),
    PLI_DEMPSTER(50, 1.3, false),
    PW_CURTIS(51, 1.37, false),
    PY_MILNER(52, 1.37, false),
    PY_HANN(53, 1.37, false),
    SB_HUANG(54, 1.3, false),
    SB_CIESZEWSKI(55, 1.3, false),
    SB_KER(56, 1.3, false),
    SB_DEMPSTER(57, 1.3, false),
    SS_NIGHGI(58, 1.3, true),
    SS_NIGH(59, 1.3, false),
    SS_GOUDIE(60, 1.3, false),
    SS_FARR(61, 1.37, false),
    SS_BARKER(62, 1.3, false),
    SW_NIGHGI(63, 1.3, true),
    SW_HUANG_PLA(64, 1.3, false),
    SW_HUANG_NAT(65, 1.3, false),
    SW_THROWER(66, 1.3, false),
    SW_CIESZEWSKI(67, 1.3, false),
    SW_KER_PLA(68, 1.3, false),
    SW_KER_NAT(69, 1.3, false),
    SW_GOUDIE_PLA(70, 1.3, false),
    SW_GOUDIE_NAT(71, 1.3, false),
    SW_DEMPSTER(72, 1.3, false),
    BL_CHEN(73, 1.3, false),
    AT_CHEN(74, 1.3, false),
    DR_CHEN(75, 1.3, false),
    PL_CHEN(76, 1.3, false),
    CWI_NIGH(77, 1.3, false),
    BP_CURTIS(78, 1.37, false),
    HWC_NIGHGI99(79, 1.3, true),
    SS_NIGHGI99(80, 1.3, true),
    SW_NIGHGI99(81, 1.3, true),
    LW_NIGHGI(82, 1.3, true),
    SW_NIGHTA(83, 1.3, false),
    CWI_NIGHGI(84, 1.3, true),
    SW_GOUDNIGH(85, 1.3, false),
    HM_MEANS(86, 1.37, false),
    SE_CHEN(87, 1.3, false),
    FDC_NIGHTA(88, 1.3, false),
    FDC_BRUCENIGH(89, 1.37, false),
    LW_NIGH(90, 1.3, false),
    SB_NIGH(91, 1.3, false),
    AT_NIGH(92, 1.3, false),
    BL_CHENAC(93, 1.3, false),
    BP_CURTISAC(94, 1.37, false),
    HM_MEANSAC(95, 1.37, false),
    FDI_THROWERAC(96, 1.3, false),
    ACB_HUANGAC(97, 1.3, false),
    PW_CURTISAC(98, 1.37, false),
    HWC_WILEYAC(99, 1.37, false),
    FDC_BRUCEAC(100, 1.37, false),
    CWC_KURUCZAC(101, 1.3, false),
    BA_KURUCZ82AC(102, 1.3, false),
    ACT_THROWERAC(103, 1.3, false),
    PY_HANNAC(104, 1.37, false),
    SE_CHENAC(105, 1.3, false),
    SW_GOUDIE_NATAC(106, 1.3, false),
    PY_NIGH(107, 1.3, false),
    PY_NIGHGI(108, 1.3, true),
    PLI_NIGHTA2004(109, 1.3, false),
    SE_NIGHTA(110, 1.3, false),
    SW_NIGHTA2004(111, 1.3, false),
    SW_GOUDIE_PLAAC(112, 1.3, false),
    PJ_HUANG(113, 1.3, false),
    PJ_HUANGAC(114, 1.3, false),
    SW_NIGHGI2004(115, 1.3, true),
    EP_NIGH(116, 1.3, false),
    BA_NIGHGI(117, 1.3, true),
    BA_NIGH(118, 1.3, false),
    SW_HU_GARCIA(119, 1.3, false),
    SE_NIGHGI(120, 1.3, true),
    SE_NIGH(121, 1.3, false),
    CWC_NIGH(122, 1.3, false),
    PLI_NIGH(123, 1.3, false);

    private static final Curve[] BY_INDEX = new Curve[values().length];

    static {
        for (Curve c : values()) {
            BY_INDEX[c.index] = c;
        }
    }

    private final int index;
    private final double breastHeight;
    private final boolean growthIntercept;

    Curve(int index, double breastHeight, boolean growthIntercept) {
        this.index = index;
        this.breastHeight = breastHeight;
        this.growthIntercept = growthIntercept;
    }

    /** Stable curve index. */
    public int index() {
        return index;
    }

    /** Breast height the curve was fitted with, in metres (1.3 or 1.37). */
    public double breastHeight() {
        return breastHeight;
    }

    public boolean isGrowthIntercept() {
        return growthIntercept;
    }

    public static Optional<Curve> fromIndex(int index) {
        if (index < 0 || index >= BY_INDEX.length) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_INDEX[index]);
    }
}
