package com.talewright.core.drafting;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Thresholds for accepting a polished scene. A polish that fails any check is discarded and the
 * pre-polish draft is kept.
 */
@Component
@ConfigurationProperties(prefix = "talewright.polish")
public class PolishProperties {

    /** Polished word count must be at least this fraction of the draft's. */
    private double minLengthRatio = 0.85;

    /** Number of trailing words compared between draft and polish. */
    private int endingWindowWords = 40;

    /** Fraction of the draft ending's distinct words that must reappear in the polished ending. */
    private double minEndingOverlap = 0.3;

    public double getMinLengthRatio() {
        return minLengthRatio;
    }

    public void setMinLengthRatio(double minLengthRatio) {
        this.minLengthRatio = minLengthRatio;
    }

    public int getEndingWindowWords() {
        return endingWindowWords;
    }

    public void setEndingWindowWords(int endingWindowWords) {
        this.endingWindowWords = endingWindowWords;
    }

    public double getMinEndingOverlap() {
        return minEndingOverlap;
    }

    public void setMinEndingOverlap(double minEndingOverlap) {
        this.minEndingOverlap = minEndingOverlap;
    }
}
