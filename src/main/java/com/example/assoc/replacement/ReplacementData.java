package com.example.assoc.replacement;

/**
 * Per-entry metadata owned by a replacement policy. The cache stores one
 * instance per entry and hands it back to the policy on every call; it never
 * looks inside.
 */
public interface ReplacementData {
}
