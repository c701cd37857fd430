package com.example.assoc.config;

import com.example.assoc.btb.SimpleBtb;
import com.example.assoc.replacement.ReplacementPolicies;
import com.example.assoc.storeset.StoreSet;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds one instance of each hardware structure from application properties.
 */
@Configuration
public class StructureConfiguration {

    @Bean
    public SimpleBtb branchTargetBuffer(
        @Value("${btb.entries:4096}") int entries,
        @Value("${btb.associativity:4}") int associativity,
        @Value("${btb.instruction-bytes:4}") int instBytes,
        @Value("${btb.tag-bits:16}") int tagBits,
        @Value("${btb.threads:1}") int threads,
        @Value("${btb.confidence-bits:2}") int confidenceBits,
        @Value("${btb.confidence-init:1}") int confidenceInit,
        @Value("${btb.replacement-policy:lru}") String replacementPolicy
    ) {
        return new SimpleBtb("btb", entries, associativity, instBytes, tagBits, threads,
            confidenceBits, confidenceInit, ReplacementPolicies.create(replacementPolicy));
    }

    @Bean
    public StoreSet storeSet(
        @Value("${storeset.clear-period:250000}") long clearPeriod,
        @Value("${storeset.ssit-entries:2048}") int ssitEntries,
        @Value("${storeset.ssit-assoc:2}") int ssitAssoc,
        @Value("${storeset.instruction-bytes:4}") int instBytes,
        @Value("${storeset.tag-bits:16}") int tagBits,
        @Value("${storeset.lfst-entries:1024}") int lfstEntries,
        @Value("${storeset.replacement-policy:lru}") String replacementPolicy
    ) {
        return new StoreSet("storeset", clearPeriod, ssitEntries, ssitAssoc, instBytes, tagBits,
            lfstEntries, ReplacementPolicies.create(replacementPolicy));
    }
}
