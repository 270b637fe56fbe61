package com.jay.alm.model;

import com.jay.alm.model.enums.SourceType;

/**
 * One validated record from a FlexQuery extract.
 * Implemented by {@link TradeExecution}, {@link CashTransaction} and {@link NavSnapshot};
 * records are identified by (source type, transaction id).
 */
public interface RawRecord {

    SourceType sourceType();

    String transactionId();
}
