package com.marginledger.domain.model;

import lombok.Value;

/** One lot equals {@code numerator / denominator} units of the base asset. */
@Value
public class LotSize {

    long numerator;
    long denominator;
}
