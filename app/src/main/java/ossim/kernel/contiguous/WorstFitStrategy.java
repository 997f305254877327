package ossim.kernel.contiguous;

import java.util.List;

/**
 * Largest free extent, provided it is large enough; lowest address wins ties.
 */
public class WorstFitStrategy implements AllocationStrategy {

    @Override
    public int findRegion(List<Extent> extents, int size) {
        int worst = -1;
        for (int i = 0; i < extents.size(); i++) {
            Extent e = extents.get(i);
            if (e.isFree() && e.getSize() >= size
                    && (worst == -1 || e.getSize() > extents.get(worst).getSize())) {
                worst = i;
            }
        }
        return worst;
    }

    @Override
    public String getName() {
        return "Worst Fit";
    }
}
