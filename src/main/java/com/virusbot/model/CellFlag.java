package com.virusbot.model;

/**
 * Flag bits carried by a cell next to its owner.
 */
public enum CellFlag {
    NORMAL(0x00),
    BASE(0x10),
    FORTIFIED(0x20),
    KILLED(0x30);

    public static final int MASK = 0x30;

    private final int bits;

    CellFlag(int bits) {
        this.bits = bits;
    }

    public int getBits() {
        return bits;
    }

    public static CellFlag fromBits(int packed) {
        int flagBits = packed & MASK;
        for (CellFlag flag : values()) {
            if (flag.bits == flagBits) {
                return flag;
            }
        }
        return NORMAL;
    }
}
