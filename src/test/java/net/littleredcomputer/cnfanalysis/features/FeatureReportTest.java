package net.littleredcomputer.cnfanalysis.features;

import com.google.common.collect.ImmutableMap;
import org.junit.Test;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.junit.Assert.assertThat;

public class FeatureReportTest {

    @Test
    public void valuesAreNormalized() {
        FeatureReport r = FeatureReport.of(ImmutableMap.of("@filename", "a.cnf"),
                ImmutableMap.of("n", 3, "x", 0.5f, "b", true, "s", "text"));
        assertThat(r.metric("n"), instanceOf(Long.class));
        assertThat(r.metric("x"), instanceOf(Double.class));
        assertThat(r.longMetric("n"), is(3L));
        assertThat(r.doubleMetric("x"), is(0.5));
        assertThat(r.booleanMetric("b"), is(true));
        assertThat(r.metrics().keySet(), contains("b", "n", "s", "x"));
    }

    @Test
    public void metaKeys() {
        assertThat(FeatureReport.metaKey("time"), is("@time"));
        assertThat(FeatureReport.attribute("@time"), is("time"));
        assertThat(FeatureReport.isMetaKey("@x"), is(true));
        assertThat(FeatureReport.isMetaKey("x"), is(false));
    }

    @Test
    public void equality() {
        FeatureReport a = FeatureReport.of(ImmutableMap.of("@f", "x"), ImmutableMap.of("n", 1));
        FeatureReport b = FeatureReport.of(ImmutableMap.of("@f", "x"), ImmutableMap.of("n", 1L));
        FeatureReport c = FeatureReport.of(ImmutableMap.of("@f", "y"), ImmutableMap.of("n", 1L));
        assertThat(a, is(b));
        assertThat(a.hashCode(), is(b.hashCode()));
        assertThat(a, not(c));
    }

    @Test(expected = IllegalArgumentException.class)
    public void metadataNeedsPrefix() {
        FeatureReport.of(ImmutableMap.of("filename", "a"), ImmutableMap.of());
    }

    @Test(expected = IllegalArgumentException.class)
    public void metricsMustNotUsePrefix() {
        FeatureReport.of(ImmutableMap.of(), ImmutableMap.of("@n", 1));
    }

    @Test(expected = IllegalArgumentException.class)
    public void unsupportedValueType() {
        FeatureReport.of(ImmutableMap.of(), ImmutableMap.of("n", new int[0]));
    }

    @Test(expected = IllegalArgumentException.class)
    public void missingMetric() {
        FeatureReport.of(ImmutableMap.of(), ImmutableMap.of()).metric("n");
    }

    @Test(expected = IllegalArgumentException.class)
    public void attributeOfPlainKey() {
        FeatureReport.attribute("time");
    }
}
