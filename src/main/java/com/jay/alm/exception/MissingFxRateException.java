package com.jay.alm.exception;

import java.time.LocalDate;

public class MissingFxRateException extends AlmException {

    public MissingFxRateException(String currency, String reportingCurrency, LocalDate date) {
        super(String.format("No %s→%s rate configured for %s", currency, reportingCurrency, date));
    }
}
