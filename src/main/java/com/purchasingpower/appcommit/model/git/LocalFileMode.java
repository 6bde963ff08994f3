package com.purchasingpower.appcommit.model.git;

/**
 * File mode of an index entry as recorded by Git.
 */
public enum LocalFileMode {
    REGULAR(0100644),
    EXECUTABLE(0100755),
    GROUP_WRITABLE(0100664),
    SYMLINK(0120000),
    SUBMODULE(0160000),
    TREE(0040000),
    UNREADABLE(0);

    private final int bits;

    LocalFileMode(int bits) {
        this.bits = bits;
    }

    public int getBits() {
        return bits;
    }

    public static LocalFileMode fromBits(int bits) {
        for (LocalFileMode mode : values()) {
            if (mode.bits == bits) {
                return mode;
            }
        }
        return UNREADABLE;
    }

    @Override
    public String toString() {
        return name() + "(" + Integer.toOctalString(bits) + ")";
    }
}
