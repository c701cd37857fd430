package com.example.assoc.btb;

/**
 * Payload of a branch-target buffer entry.
 */
public class BtbEntry {

    private final int threadId;
    private final long target;
    private final BranchType branchType;
    private final String inst;
    private final SaturatingCounter confidence;

    public BtbEntry(int threadId, long target, BranchType branchType, String inst, SaturatingCounter confidence) {
        this.threadId = threadId;
        this.target = target;
        this.branchType = branchType;
        this.inst = inst;
        this.confidence = confidence;
    }

    public int getThreadId() {
        return threadId;
    }

    public long getTarget() {
        return target;
    }

    public BranchType getBranchType() {
        return branchType;
    }

    /** Label of the branch instruction, may be null. */
    public String getInst() {
        return inst;
    }

    public SaturatingCounter getConfidence() {
        return confidence;
    }

    @Override
    public String toString() {
        return String.format("tid: %d target: %#x type: %s conf: %s inst: %s",
            threadId, target, branchType, confidence, inst);
    }
}
