package ossim.kernel.contiguous;

import java.util.List;

/**
 * Smallest free extent that is large enough; lowest address wins ties.
 */
public class BestFitStrategy implements AllocationStrategy {

    @Override
    public int findRegion(List<Extent> extents, int size) {
        int best = -1;
        for (int i = 0; i < extents.size(); i++) {
            Extent e = extents.get(i);
            if (e.isFree() && e.getSize() >= size
                    && (best == -1 || e.getSize() < extents.get(best).getSize())) {
                best = i;
            }
        }
        return best;
    }

    @Override
    public String getName() {
        return "Best Fit";
    }
}
