package com.example.assoc.api;

import com.example.assoc.btb.BranchType;
import com.example.assoc.btb.SimpleBtb;
import com.example.assoc.indexing.ThreadedAddress;
import com.example.assoc.replacement.ReplacementPolicies;
import com.example.assoc.storeset.StoreSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Debug surface over the structures. The engine is single threaded, so every
 * handler holds the controller lock.
 */
@RestController
public class StructureController {

    private static final Logger logger = LoggerFactory.getLogger(StructureController.class);

    private SimpleBtb btb;
    private final StoreSet storeSet;

    public StructureController(SimpleBtb btb, StoreSet storeSet) {
        this.btb = btb;
        this.storeSet = storeSet;
    }

    @GetMapping("/btb/lookup")
    public synchronized Map<String, Object> lookup(
        @RequestParam String pc,
        @RequestParam(defaultValue = "0") int tid,
        @RequestParam(defaultValue = "NO_BRANCH") BranchType type
    ) {
        ThreadedAddress key = new ThreadedAddress(Long.decode(pc), tid);
        OptionalLong target = btb.lookup(key, type);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("pc", pc);
        result.put("tid", tid);
        result.put("hit", target.isPresent());
        if (target.isPresent()) {
            result.put("target", "0x" + Long.toHexString(target.getAsLong()));
            result.put("confidence", btb.getConfidence(key).orElse(0));
        }
        return result;
    }

    @GetMapping("/btb/update")
    public synchronized String update(
        @RequestParam String pc,
        @RequestParam String target,
        @RequestParam(defaultValue = "0") int tid,
        @RequestParam(defaultValue = "DIRECT_UNCOND") BranchType type,
        @RequestParam(required = false) String inst
    ) {
        btb.update(new ThreadedAddress(Long.decode(pc), tid), Long.decode(target), type, inst);
        return "Updated " + pc + " -> " + target;
    }

    @GetMapping("/btb/dump")
    public synchronized List<String> dumpBtb() {
        return btb.dump();
    }

    @GetMapping("/btb/reset")
    public synchronized void resetBtb() {
        btb.memInvalidate();
    }

    @GetMapping("/btb/config")
    public synchronized String configureBtb(
        @RequestParam(defaultValue = "4096") int entries,
        @RequestParam(defaultValue = "4") int associativity,
        @RequestParam(defaultValue = "lru") String policy,
        @RequestParam(defaultValue = "4") int instBytes,
        @RequestParam(defaultValue = "16") int tagBits,
        @RequestParam(defaultValue = "1") int threads,
        @RequestParam(defaultValue = "2") int confidenceBits,
        @RequestParam(defaultValue = "1") int confidenceInit
    ) {
        // build first, so a bad configuration leaves the current BTB in place
        SimpleBtb rebuilt = new SimpleBtb(btb.getName(), entries, associativity, instBytes, tagBits,
            threads, confidenceBits, confidenceInit, ReplacementPolicies.create(policy));
        this.btb = rebuilt;
        return "Rebuilt BTB with entries=" + entries + ", associativity=" + associativity + ", policy=" + policy;
    }

    @GetMapping("/storeset/violation")
    public synchronized String violation(@RequestParam String storePc, @RequestParam String loadPc) {
        storeSet.violation(Long.decode(storePc), Long.decode(loadPc));
        return "Recorded violation between store " + storePc + " and load " + loadPc;
    }

    @GetMapping("/storeset/check")
    public synchronized Map<String, Object> check(@RequestParam String pc) {
        long seq = storeSet.checkInst(Long.decode(pc));
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("pc", pc);
        result.put("dependent", seq != StoreSet.NO_DEPENDENCE);
        result.put("storeSeqNum", seq);
        return result;
    }

    @GetMapping("/storeset/dump")
    public synchronized List<String> dumpStoreSet() {
        return storeSet.dump();
    }

    @GetMapping("/storeset/reset")
    public synchronized void resetStoreSet() {
        storeSet.clear();
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, String> badRequest(IllegalArgumentException e) {
        logger.warn("Rejected request: {}", e.getMessage());
        return Map.of("error", String.valueOf(e.getMessage()));
    }
}
