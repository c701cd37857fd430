package com.example.assoc.storeset;

import static org.junit.Assert.*;

import com.example.assoc.core.CacheConfigurationException;
import com.example.assoc.replacement.LruReplacementPolicy;
import org.junit.Before;
import org.junit.Test;

public class StoreSetTest {

    // SSIDs below follow (pc ^ (pc >> 10)) % 16
    private static final long STORE_A = 0x1000L;
    private static final long LOAD_A = 0x2000L;   // ssid 8
    private static final long STORE_B = 0x1010L;
    private static final long LOAD_B = 0x3010L;   // ssid 12

    private StoreSet storeSet;

    @Before
    public void setUp() {
        storeSet = new StoreSet("ss", 1_000, 64, 4, 4, 16, 16, new LruReplacementPolicy());
    }

    @Test
    public void unknownInstructionsHaveNoDependence() {
        assertEquals(StoreSet.NO_DEPENDENCE, storeSet.checkInst(LOAD_A));
        storeSet.insertStore(STORE_A, 10, 0);
        assertEquals(0, storeSet.inFlightStores());
    }

    @Test
    public void loadWaitsForStoreAfterViolation() {
        storeSet.violation(STORE_A, LOAD_A);
        assertEquals(StoreSet.NO_DEPENDENCE, storeSet.checkInst(LOAD_A));

        storeSet.insertStore(STORE_A, 10, 0);

        assertEquals(10, storeSet.checkInst(LOAD_A));
        assertEquals(1, storeSet.inFlightStores());
    }

    @Test
    public void issuedStoreReleasesDependents() {
        storeSet.violation(STORE_A, LOAD_A);
        storeSet.insertStore(STORE_A, 10, 0);

        storeSet.issued(LOAD_A, 11, false);
        assertEquals(10, storeSet.checkInst(LOAD_A));

        storeSet.issued(STORE_A, 10, true);
        assertEquals(StoreSet.NO_DEPENDENCE, storeSet.checkInst(LOAD_A));
        assertEquals(0, storeSet.inFlightStores());
    }

    @Test
    public void issuingAnOlderStoreKeepsTheYoungerOne() {
        storeSet.violation(STORE_A, LOAD_A);
        storeSet.insertStore(STORE_A, 10, 0);
        storeSet.insertStore(STORE_A, 12, 0);

        storeSet.issued(STORE_A, 10, true);

        assertEquals(12, storeSet.checkInst(LOAD_A));
        assertEquals(1, storeSet.inFlightStores());
    }

    @Test
    public void issuedStoreLeavesTheListAfterItsSsitEntryIsEvicted() {
        storeSet.violation(STORE_A, LOAD_A);
        storeSet.insertStore(STORE_A, 10, 0);
        // four more PCs in SSIT set 0 push STORE_A out of the 4-way set
        storeSet.violation(0x40L, 0x80L);
        storeSet.violation(0xC0L, 0x100L);
        assertFalse(storeSet.ssit().lookup(STORE_A).isPresent());

        storeSet.issued(STORE_A, 10, true);

        assertEquals(0, storeSet.inFlightStores());
    }

    @Test
    public void squashForgetsYoungerStoresOnly() {
        storeSet.violation(STORE_A, LOAD_A);
        storeSet.violation(STORE_B, LOAD_B);
        storeSet.insertStore(STORE_A, 10, 0);
        storeSet.insertStore(STORE_B, 20, 0);

        storeSet.squash(15, 0);

        assertEquals(10, storeSet.checkInst(LOAD_A));
        assertEquals(StoreSet.NO_DEPENDENCE, storeSet.checkInst(LOAD_B));
        assertEquals(1, storeSet.inFlightStores());

        storeSet.squash(10, 0);
        assertEquals(10, storeSet.checkInst(LOAD_A));
    }

    @Test
    public void violationBetweenTwoSetsMergesOntoTheSmallerId() {
        storeSet.violation(STORE_A, LOAD_A);
        storeSet.violation(STORE_B, LOAD_B);

        storeSet.violation(STORE_A, LOAD_B);

        assertEquals(8, storeSet.ssit().lookup(LOAD_B).get().getPayload().getSsid());
        storeSet.insertStore(STORE_A, 20, 0);
        assertEquals(20, storeSet.checkInst(LOAD_B));
        assertEquals(20, storeSet.checkInst(LOAD_A));

        storeSet.insertStore(STORE_B, 30, 0);
        assertEquals(20, storeSet.checkInst(LOAD_B));
    }

    @Test
    public void newMemberJoinsExistingSet() {
        storeSet.violation(STORE_A, LOAD_A);
        storeSet.violation(STORE_B, LOAD_A);

        storeSet.insertStore(STORE_B, 40, 0);

        assertEquals(40, storeSet.checkInst(LOAD_A));
        assertEquals(40, storeSet.checkInst(STORE_A));
    }

    @Test
    public void predictorIsWipedAfterClearPeriod() {
        StoreSet small = new StoreSet("ss", 2, 64, 4, 4, 16, 16, new LruReplacementPolicy());
        small.violation(STORE_A, LOAD_A);

        small.insertLoad(LOAD_A, 1);
        small.insertStore(STORE_A, 2, 0);
        assertEquals(2, small.checkInst(LOAD_A));

        small.insertLoad(LOAD_A, 3);

        assertEquals(StoreSet.NO_DEPENDENCE, small.checkInst(LOAD_A));
        assertEquals(0, small.ssit().validEntryCount());
        assertEquals(0, small.inFlightStores());
    }

    @Test
    public void clearDropsAllState() {
        storeSet.violation(STORE_A, LOAD_A);
        storeSet.insertStore(STORE_A, 10, 0);

        storeSet.clear();

        assertEquals(StoreSet.NO_DEPENDENCE, storeSet.checkInst(LOAD_A));
        assertEquals(0, storeSet.inFlightStores());
        assertEquals(0, storeSet.ssit().validEntryCount());
    }

    @Test
    public void dumpListsInFlightStoresAndTable() {
        storeSet.violation(STORE_A, LOAD_A);
        storeSet.insertStore(STORE_A, 10, 0);

        assertTrue(storeSet.dump().contains("  seq 10 -> ssid 8"));
        assertEquals(1 + 1 + 64, storeSet.dump().size());
    }

    @Test(expected = CacheConfigurationException.class)
    public void ssitSizeMustBeAPowerOfTwo() {
        new StoreSet("ss", 1_000, 48, 4, 4, 16, 16, new LruReplacementPolicy());
    }

    @Test(expected = CacheConfigurationException.class)
    public void lfstSizeMustBeAPowerOfTwo() {
        new StoreSet("ss", 1_000, 64, 4, 4, 16, 12, new LruReplacementPolicy());
    }
}
