package org.masmtext;

import java.util.Objects;

/** Architecture-specific register id. */
public final class RegisterDescriptor {
    public final int major;   // register class
    public final int minor;   // register number inside the class
    public final int offset;  // lowest bit used
    public final int nBits;   // width of the slice

    public RegisterDescriptor(int major, int minor, int offset, int nBits) {
        this.major = major;
        this.minor = minor;
        this.offset = offset;
        this.nBits = nBits;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RegisterDescriptor)) return false;
        RegisterDescriptor d = (RegisterDescriptor) o;
        return major == d.major && minor == d.minor && offset == d.offset && nBits == d.nBits;
    }

    @Override public int hashCode() { return Objects.hash(major, minor, offset, nBits); }

    @Override public String toString() {
        return major + "." + minor + "@" + offset + "+" + nBits;
    }
}
