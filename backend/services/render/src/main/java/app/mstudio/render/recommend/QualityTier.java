package app.mstudio.render.recommend;

public enum QualityTier {
    fast(0.20, 0.55, 0.25),
    balanced(0.40, 0.35, 0.25),
    premium(0.55, 0.20, 0.25);

    private final double qualityWeight;
    private final double latencyWeight;
    private final double fitWeight;

    QualityTier(double qualityWeight, double latencyWeight, double fitWeight) {
        this.qualityWeight = qualityWeight;
        this.latencyWeight = latencyWeight;
        this.fitWeight = fitWeight;
    }

    public double qualityWeight() {
        return qualityWeight;
    }

    public double latencyWeight() {
        return latencyWeight;
    }

    public double fitWeight() {
        return fitWeight;
    }
}
