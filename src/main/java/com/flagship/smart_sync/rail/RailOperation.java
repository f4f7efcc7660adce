package com.flagship.smart_sync.rail;

/**
 * What a rail can do.
 *
 * - READ: the rail's ledger data can be fetched and mirrored
 * - PUSH: locally originated records can be sent to the rail for execution
 */
public enum RailOperation {
    READ,
    PUSH
}
