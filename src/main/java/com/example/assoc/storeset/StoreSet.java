package com.example.assoc.storeset;

import com.example.assoc.core.AssociativeCache;
import com.example.assoc.core.CacheConfigurationException;
import com.example.assoc.core.CacheEntry;
import com.example.assoc.indexing.SetAssociative;
import com.example.assoc.replacement.ReplacementPolicy;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Store set memory dependence predictor (Chrysos and Emer, "Memory
 * Dependence Prediction using Store Sets").
 *
 * <p>The SSIT (store set id table) maps load and store PCs to a store set id.
 * The LFST (last fetched store table) remembers, per store set, the sequence
 * number of the youngest store fetched so far; a load or store that belongs
 * to that set waits for it.
 */
public class StoreSet {

    private static final Logger logger = LoggerFactory.getLogger(StoreSet.class);

    /** Returned by {@link #checkInst} when the instruction depends on no store. */
    public static final long NO_DEPENDENCE = 0;

    private final String name;
    private final long clearPeriod;
    private final int lfstSize;

    private final AssociativeCache<Long, SsitEntry> ssit;

    private final long[] lfst;
    private final boolean[] validLfst;

    // in-flight stores by sequence number, youngest first
    private final TreeMap<Long, Integer> storeList = new TreeMap<>(Comparator.reverseOrder());

    private long memOpsPred;

    public StoreSet(String name,
                    long clearPeriod,
                    int ssitEntries,
                    int ssitAssoc,
                    int instBytes,
                    int tagBits,
                    int lfstSize,
                    ReplacementPolicy replPolicy) {
        if (!isPowerOf2(ssitEntries)) {
            throw new CacheConfigurationException("Invalid SSIT size: " + ssitEntries);
        }
        if (!isPowerOf2(lfstSize)) {
            throw new CacheConfigurationException("Invalid LFST size: " + lfstSize);
        }
        if (clearPeriod <= 0) {
            throw new CacheConfigurationException("Clear period must be positive: " + clearPeriod);
        }

        this.name = name;
        this.clearPeriod = clearPeriod;
        this.lfstSize = lfstSize;
        this.ssit = new AssociativeCache<>(name + ".ssit", ssitEntries, ssitAssoc, replPolicy,
            new SetAssociative(ssitEntries, ssitAssoc, instBytes, tagBits));
        this.lfst = new long[lfstSize];
        this.validLfst = new boolean[lfstSize];

        logger.info("Created store set predictor {}: SSIT {} entries ({}-way), LFST {} entries, clear period {}",
            name, ssitEntries, ssitAssoc, lfstSize, clearPeriod);
    }

    public String getName() {
        return name;
    }

    /**
     * Records that the load at {@code loadPc} executed before an older store
     * at {@code storePc} it depended on. Both end up in the same store set.
     */
    public void violation(long storePc, long loadPc) {
        Optional<CacheEntry<SsitEntry>> loadEntry = ssit.lookup(loadPc);
        Optional<CacheEntry<SsitEntry>> storeEntry = ssit.lookup(storePc);

        if (!loadEntry.isPresent() && !storeEntry.isPresent()) {
            // neither has a store set yet, make a new one
            long newSet = calcSsid(loadPc);
            ssit.insert(loadPc, new SsitEntry(newSet));
            ssit.insert(storePc, new SsitEntry(newSet));
            logger.debug("{}: new store set {} for load {} and store {}",
                name, newSet, hex(loadPc), hex(storePc));
        } else if (loadEntry.isPresent() && !storeEntry.isPresent()) {
            long loadSsid = loadEntry.get().getPayload().getSsid();
            ssit.insert(storePc, new SsitEntry(loadSsid));
            logger.debug("{}: store {} joins store set {} of load {}",
                name, hex(storePc), loadSsid, hex(loadPc));
        } else if (!loadEntry.isPresent()) {
            long storeSsid = storeEntry.get().getPayload().getSsid();
            ssit.insert(loadPc, new SsitEntry(storeSsid));
            logger.debug("{}: load {} joins store set {} of store {}",
                name, hex(loadPc), storeSsid, hex(storePc));
        } else {
            SsitEntry load = loadEntry.get().getPayload();
            SsitEntry store = storeEntry.get().getPayload();
            // merge onto the smaller id
            if (store.getSsid() > load.getSsid()) {
                store.setSsid(load.getSsid());
            } else {
                load.setSsid(store.getSsid());
            }
            logger.debug("{}: merged store sets of load {} and store {} into {}",
                name, hex(loadPc), hex(storePc), load.getSsid());
        }
    }

    /**
     * Counts a predicted memory operation and wipes the predictor once the
     * clear period is exceeded.
     */
    public void checkClear() {
        memOpsPred++;
        if (memOpsPred > clearPeriod) {
            logger.info("{}: wiping predictor after {} memory operations", name, memOpsPred - 1);
            memOpsPred = 0;
            clear();
        }
    }

    public void insertLoad(long loadPc, long loadSeqNum) {
        // loads never become the last fetched store; only the clear period is affected
        checkClear();
    }

    public void insertStore(long storePc, long storeSeqNum, int tid) {
        checkClear();

        Optional<CacheEntry<SsitEntry>> entry = ssit.lookup(storePc);
        if (!entry.isPresent()) {
            return;
        }

        int storeSsid = (int) entry.get().getPayload().getSsid();
        lfst[storeSsid] = storeSeqNum;
        validLfst[storeSsid] = true;
        storeList.put(storeSeqNum, storeSsid);
        logger.debug("{}: store {} (seq {}, tid {}) is now last fetched store of set {}",
            name, hex(storePc), storeSeqNum, tid, storeSsid);
    }

    /**
     * @return sequence number of the store the instruction must wait for, or
     *         {@link #NO_DEPENDENCE}
     */
    public long checkInst(long pc) {
        Optional<CacheEntry<SsitEntry>> entry = ssit.lookup(pc);
        if (!entry.isPresent()) {
            return NO_DEPENDENCE;
        }
        int instSsid = (int) entry.get().getPayload().getSsid();
        if (!validLfst[instSsid]) {
            return NO_DEPENDENCE;
        }
        return lfst[instSsid];
    }

    public void issued(long issuedPc, long issuedSeqNum, boolean isStore) {
        // only stores leave a mark in the LFST
        if (!isStore) {
            return;
        }

        // the store leaves the in-flight list even if its SSIT entry is gone
        storeList.remove(issuedSeqNum);

        Optional<CacheEntry<SsitEntry>> entry = ssit.lookup(issuedPc);
        if (!entry.isPresent()) {
            return;
        }

        int storeSsid = (int) entry.get().getPayload().getSsid();
        // the LFST may already point at a younger store of the same set
        if (validLfst[storeSsid] && lfst[storeSsid] == issuedSeqNum) {
            validLfst[storeSsid] = false;
        }
    }

    /**
     * Forgets every in-flight store younger than {@code squashedNum}.
     */
    public void squash(long squashedNum, int tid) {
        logger.debug("{}: squashing stores younger than {} for tid {}", name, squashedNum, tid);
        Iterator<Map.Entry<Long, Integer>> it = storeList.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<Long, Integer> store = it.next();
            if (store.getKey() <= squashedNum) {
                break;
            }
            int ssid = store.getValue();
            if (lfst[ssid] == store.getKey()) {
                validLfst[ssid] = false;
            }
            it.remove();
        }
    }

    public void clear() {
        ssit.clear();
        Arrays.fill(validLfst, false);
        storeList.clear();
    }

    public int inFlightStores() {
        return storeList.size();
    }

    public List<String> dump() {
        List<String> lines = new ArrayList<>();
        lines.add(name + ": " + storeList.size() + " in-flight stores");
        for (Map.Entry<Long, Integer> store : storeList.entrySet()) {
            lines.add("  seq " + store.getKey() + " -> ssid " + store.getValue());
        }
        lines.addAll(ssit.dump());
        return lines;
    }

    AssociativeCache<Long, SsitEntry> ssit() {
        return ssit;
    }

    private long calcSsid(long pc) {
        return Math.floorMod(pc ^ (pc >>> 10), (long) lfstSize);
    }

    private static boolean isPowerOf2(long n) {
        return n > 0 && (n & (n - 1)) == 0;
    }

    private static String hex(long pc) {
        return "0x" + Long.toHexString(pc);
    }
}
