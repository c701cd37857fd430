package com.example.assoc.storeset;

/**
 * Payload of a store-set id table entry: the id of the store set the
 * instruction belongs to. Mutable because merging two store sets rewrites
 * the id in place.
 */
public class SsitEntry {

    private long ssid;

    public SsitEntry(long ssid) {
        this.ssid = ssid;
    }

    public long getSsid() {
        return ssid;
    }

    public void setSsid(long ssid) {
        this.ssid = ssid;
    }

    @Override
    public String toString() {
        return "ssid: " + ssid;
    }
}
