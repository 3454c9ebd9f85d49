package com.vcsight.ingestor.transform;

import java.util.Map;

/** A cleaned record ready for export: tagged, and flattenable to named columns. */
public interface TabularRow {

    String environment();

    String client();

    /** Column name → value, in export column order. */
    Map<String, Object> toColumns();
}
