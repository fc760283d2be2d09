package likelion._th.safepath.domain;

// 확률 -> 5단계 등급
public enum SafetyBand {
    VERY_SAFE(0.8),
    SAFE(0.6),
    MODERATE(0.4),
    UNSAFE(0.2),
    DANGEROUS(Double.NEGATIVE_INFINITY);

    private final double lowerBound;

    SafetyBand(double lowerBound) {
        this.lowerBound = lowerBound;
    }

    public static SafetyBand fromProbability(double probability) {
        for (SafetyBand band : values()) {
            if (probability >= band.lowerBound) {
                return band;
            }
        }
        return DANGEROUS;
    }
}
