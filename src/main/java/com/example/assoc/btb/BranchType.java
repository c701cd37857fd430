package com.example.assoc.btb;

public enum BranchType {
    NO_BRANCH,
    RETURN,
    CALL_DIRECT,
    CALL_INDIRECT,
    DIRECT_COND,
    DIRECT_UNCOND,
    INDIRECT_COND,
    INDIRECT_UNCOND
}
