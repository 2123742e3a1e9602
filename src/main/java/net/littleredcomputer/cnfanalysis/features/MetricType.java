package net.littleredcomputer.cnfanalysis.features;

/**
 * Value domains of metrics. Text forms are those produced by {@link String#valueOf}.
 */
public enum MetricType {
    INTEGER {
        @Override
        public Object parse(String text) {
            return Long.parseLong(text.trim());
        }
    },
    REAL {
        @Override
        public Object parse(String text) {
            return Double.parseDouble(text.trim());
        }
    },
    BOOLEAN {
        @Override
        public Object parse(String text) {
            String t = text.trim();
            if (t.equalsIgnoreCase("true")) return Boolean.TRUE;
            if (t.equalsIgnoreCase("false")) return Boolean.FALSE;
            throw new IllegalArgumentException("not a boolean: " + text);
        }
    };

    public abstract Object parse(String text);
}
