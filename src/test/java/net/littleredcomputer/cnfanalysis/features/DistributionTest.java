package net.littleredcomputer.cnfanalysis.features;

import com.google.common.math.Stats;
import org.junit.Test;

import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThat;

public class DistributionTest {

    @Test
    public void singleValueHasNoSpread() {
        assertThat(Distribution.standardDeviation(Stats.of(4)), is(0.0));
    }

    @Test
    public void twoValuesUsePopulationFormula() {
        assertThat(Distribution.standardDeviation(Stats.of(1, 3)), closeTo(1.0, 1e-12));
    }

    @Test
    public void threeOrMoreValuesUseSampleFormula() {
        assertThat(Distribution.standardDeviation(Stats.of(1, 2, 3)), closeTo(1.0, 1e-12));
        assertThat(Distribution.standardDeviation(Stats.of(2, 4, 4, 4, 5, 5, 7, 9)), closeTo(2.138089935, 1e-9));
    }

    @Test
    public void entropyTerm() {
        assertThat(Distribution.entropyTerm(0.5), closeTo(0.5, 1e-12));
        assertThat(Distribution.entropyTerm(1.0), closeTo(0.0, 1e-12));
        assertThat(Distribution.entropyTerm(0.25), closeTo(0.5, 1e-12));
        assertThat(Distribution.entropyTerm(0.0), is(0.0));
        assertThat(Distribution.entropyTerm(-1.0), is(0.0));
    }
}
