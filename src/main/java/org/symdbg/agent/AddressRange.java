package org.symdbg.agent;

/** [begin, end) */
public class AddressRange {
    public long begin;
    public long end;

    public AddressRange() {}

    public AddressRange(long begin, long end) {
        this.begin = begin;
        this.end = end;
    }

    public long size() {
        return end - begin;
    }

    @Override
    public boolean equals(Object other) {
        if (!(other instanceof AddressRange)) return false;
        var that = (AddressRange) other;
        return this.begin == that.begin && this.end == that.end;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(begin) * 31 + Long.hashCode(end);
    }

    @Override
    public String toString() {
        return String.format("[0x%x, 0x%x)", begin, end);
    }
}
