package net.littleredcomputer.cnfanalysis.features;

import com.google.common.math.DoubleMath;
import com.google.common.math.Stats;

final class Distribution {
    private Distribution() {}

    /**
     * Sample standard deviation, except that samples of one or two values use the population
     * formula (the sample formula is undefined for one value and erratic for two).
     */
    static double standardDeviation(Stats s) {
        return s.count() <= 2 ? s.populationStandardDeviation() : s.sampleStandardDeviation();
    }

    /**
     * @return -x log2 x, or 0 when x is not positive
     */
    static double entropyTerm(double x) {
        return x > 0.0 ? -x * DoubleMath.log2(x) : 0.0;
    }
}
