package com.eainde.verity.knowledge;

/**
 * @param citation          regulation reference
 * @param citedText         quoted article text
 * @param penaltyPercentage share of annual revenue at risk
 * @param basePenalty       minimum penalty in EUR
 * @param originFraud       whether a breach counts as origin fraud
 */
public record RegulationEntry(
        String citation,
        String citedText,
        double penaltyPercentage,
        double basePenalty,
        boolean originFraud
) {
}
