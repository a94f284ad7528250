package backend.mc;

import java.util.Objects;

public abstract class MCOperand {
    public static final int REG_SIZE = 32;

    public boolean isVirtual() {
        return false;
    }

    public boolean isFixed() {
        return false;
    }

    public static class MCImm extends MCOperand {
        private final int imm;

        public MCImm(int imm) {
            this.imm = imm;
        }

        public int getImm() {
            return imm;
        }

        @Override
        public String toString() {
            return String.valueOf(this.imm);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            MCImm mcImm = (MCImm) o;
            return imm == mcImm.imm;
        }

        @Override
        public int hashCode() {
            return Objects.hash(imm);
        }
    }

    public static class MCNull extends MCOperand {
        public static final MCNull NULL = new MCNull();

        private MCNull() {}

        @Override
        public String toString() {
            return "null";
        }
    }

    public abstract static class MCReg extends MCOperand {
        private final int nr;
        private final int offset;
        private final int typeSize;
        private final int components;
        private final boolean scalar;

        protected MCReg(int nr, int offset, int typeSize, int components, boolean scalar) {
            assert nr >= 0 && offset >= 0;
            assert typeSize == 1 || typeSize == 2 || typeSize == 4 || typeSize == 8;
            this.nr = nr;
            this.offset = offset;
            this.typeSize = typeSize;
            this.components = components;
            this.scalar = scalar;
        }

        public int getNr() {
            return nr;
        }

        public int getOffset() {
            return offset;
        }

        public int getTypeSize() {
            return typeSize;
        }

        public int getComponents() {
            return components;
        }

        public boolean isScalar() {
            return scalar;
        }

        public int componentSize(int execSize) {
            return scalar ? typeSize : typeSize * execSize;
        }

        public int bytes(int execSize) {
            return components * componentSize(execSize);
        }

        public abstract MCReg withNr(int nr);

        public abstract MCReg withOffset(int offset);

        public MCReg byteOffset(int delta) {
            return withOffset(offset + delta);
        }

        protected String region() {
            StringBuilder sb = new StringBuilder();
            if (offset % REG_SIZE != 0 || offset >= REG_SIZE) {
                sb.append("+").append(offset);
            }
            sb.append(scalar ? "<0>" : "").append(":").append(typeSize * 8);
            if (components > 1) {
                sb.append("x").append(components);
            }
            return sb.toString();
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            MCReg that = (MCReg) o;
            return nr == that.nr && offset == that.offset && typeSize == that.typeSize &&
                    components == that.components && scalar == that.scalar;
        }

        @Override
        public int hashCode() {
            return Objects.hash(getClass(), nr, offset, typeSize, components, scalar);
        }
    }

    public static class MCVirtualReg extends MCReg {

        public MCVirtualReg(int nr) {
            this(nr, 0, 4, 1, false);
        }

        public MCVirtualReg(int nr, int offset, int typeSize, int components, boolean scalar) {
            super(nr, offset, typeSize, components, scalar);
        }

        @Override
        public boolean isVirtual() {
            return true;
        }

        @Override
        public MCVirtualReg withNr(int nr) {
            return new MCVirtualReg(nr, getOffset(), getTypeSize(), getComponents(), isScalar());
        }

        @Override
        public MCVirtualReg withOffset(int offset) {
            return new MCVirtualReg(getNr(), offset, getTypeSize(), getComponents(), isScalar());
        }

        public MCVirtualReg withType(int typeSize, int components) {
            return new MCVirtualReg(getNr(), getOffset(), typeSize, components, isScalar());
        }

        public MCFixedReg toFixed(int hwNr) {
            return new MCFixedReg(hwNr, getOffset(), getTypeSize(), getComponents(), isScalar());
        }

        @Override
        public String toString() {
            return "vgrf" + getNr() + region();
        }
    }

    public static class MCFixedReg extends MCReg {

        public MCFixedReg(int nr) {
            this(nr, 0, 4, 1, false);
        }

        public MCFixedReg(int nr, int offset, int typeSize, int components, boolean scalar) {
            super(nr, offset, typeSize, components, scalar);
        }

        @Override
        public boolean isFixed() {
            return true;
        }

        @Override
        public MCFixedReg withNr(int nr) {
            return new MCFixedReg(nr, getOffset(), getTypeSize(), getComponents(), isScalar());
        }

        @Override
        public MCFixedReg withOffset(int offset) {
            return new MCFixedReg(getNr(), offset, getTypeSize(), getComponents(), isScalar());
        }

        @Override
        public String toString() {
            return "g" + getNr() + region();
        }
    }
}
