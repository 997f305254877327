package ossim.kernel.contiguous;

public enum AllocationPolicy {
    FIRST_FIT,
    BEST_FIT,
    WORST_FIT;

    public AllocationStrategy createStrategy() {
        switch (this) {
            case BEST_FIT:
                return new BestFitStrategy();
            case WORST_FIT:
                return new WorstFitStrategy();
            case FIRST_FIT:
            default:
                return new FirstFitStrategy();
        }
    }
}
