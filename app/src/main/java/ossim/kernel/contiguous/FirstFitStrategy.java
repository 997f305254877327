package ossim.kernel.contiguous;

import java.util.List;

/**
 * Lowest-addressed free extent that is large enough.
 */
public class FirstFitStrategy implements AllocationStrategy {

    @Override
    public int findRegion(List<Extent> extents, int size) {
        for (int i = 0; i < extents.size(); i++) {
            Extent e = extents.get(i);
            if (e.isFree() && e.getSize() >= size) {
                return i;
            }
        }
        return -1;
    }

    @Override
    public String getName() {
        return "First Fit";
    }
}
