package backend.mc;

import java.util.ArrayList;

public class VirtualRegisters {
    private final ArrayList<Integer> sizes = new ArrayList<>();

    public int allocate(int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("virtual register size must be positive: " + size);
        }
        sizes.add(size);
        return sizes.size() - 1;
    }

    public int size(int nr) {
        return sizes.get(nr);
    }

    public int count() {
        return sizes.size();
    }
}
