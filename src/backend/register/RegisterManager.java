package backend.register;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class RegisterManager {
    private final int capacity;
    private final int maxClassSize;
    private final ArrayList<RegisterClass> classes = new ArrayList<>();

    public static class RegisterClass {
        private final int size;
        private final int capacity;

        private RegisterClass(int size, int capacity) {
            this.size = size;
            this.capacity = capacity;
        }

        public int getSize() {
            return size;
        }

        public int getCapacity() {
            return capacity;
        }

        public int getRegCount() {
            return capacity - size + 1;
        }

        public boolean contains(int reg) {
            return reg >= 0 && reg + size <= capacity;
        }

        public List<Integer> getRegs() {
            ArrayList<Integer> regs = new ArrayList<>();
            for (int reg = 0; reg + size <= capacity; ++reg) {
                regs.add(reg);
            }
            return Collections.unmodifiableList(regs);
        }

        /**
         * Upper bound of the base offsets of this class a neighbour of class {@code other} can block.
         */
        public int conflicts(RegisterClass other) {
            return Math.min(getRegCount(), size + other.size - 1);
        }

        @Override
        public String toString() {
            return "class" + size;
        }
    }

    public RegisterManager(int capacity, int maxClassSize) {
        if (maxClassSize <= 0 || maxClassSize > capacity) {
            maxClassSize = capacity;
        }
        this.capacity = capacity;
        this.maxClassSize = maxClassSize;
        for (int size = 1; size <= maxClassSize; ++size) {
            classes.add(new RegisterClass(size, capacity));
        }
    }

    public static RegisterManager forDevice(DeviceInfo devinfo) {
        return new RegisterManager(devinfo.getGrfCount(), devinfo.getMaxClassSize());
    }

    public int getCapacity() {
        return capacity;
    }

    public int getMaxClassSize() {
        return maxClassSize;
    }

    public RegisterClass getClass(int size) {
        if (size <= 0 || size > maxClassSize) {
            throw new IllegalArgumentException("no register class of size " + size + " (max " + maxClassSize + ")");
        }
        return classes.get(size - 1);
    }
}
