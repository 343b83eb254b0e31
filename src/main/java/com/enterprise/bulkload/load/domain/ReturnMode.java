package com.enterprise.bulkload.load.domain;

public enum ReturnMode {
    NONE,
    /** Report the rows the run inserted. */
    INSERTED,
    /** Also report rows updated by an upsert, looking their id up if needed. */
    AFFECTED
}
