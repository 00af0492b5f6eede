package com.talewright.core.drafting;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "talewright.drafting")
public class DraftingProperties {

    private int maxRevisions = 2;
    private int beatThresholdWords = 2500;
    private int maxBeats = 4;
    private double expansionRatio = 0.8;
    private int maxExpansions = 2;
    private int overlapMinChars = ProseText.DEFAULT_MIN_OVERLAP;
    private int overlapWindowChars = ProseText.DEFAULT_OVERLAP_WINDOW;
    private int tailChars = 1200;
    private int archivistInterval = 1;
    private int defaultTargetWords = 1500;

    public int getMaxRevisions() {
        return maxRevisions;
    }

    public void setMaxRevisions(int maxRevisions) {
        this.maxRevisions = maxRevisions;
    }

    public int getBeatThresholdWords() {
        return beatThresholdWords;
    }

    public void setBeatThresholdWords(int beatThresholdWords) {
        this.beatThresholdWords = beatThresholdWords;
    }

    public int getMaxBeats() {
        return maxBeats;
    }

    public void setMaxBeats(int maxBeats) {
        this.maxBeats = maxBeats;
    }

    public double getExpansionRatio() {
        return expansionRatio;
    }

    public void setExpansionRatio(double expansionRatio) {
        this.expansionRatio = expansionRatio;
    }

    public int getMaxExpansions() {
        return maxExpansions;
    }

    public void setMaxExpansions(int maxExpansions) {
        this.maxExpansions = maxExpansions;
    }

    public int getOverlapMinChars() {
        return overlapMinChars;
    }

    public void setOverlapMinChars(int overlapMinChars) {
        this.overlapMinChars = overlapMinChars;
    }

    public int getOverlapWindowChars() {
        return overlapWindowChars;
    }

    public void setOverlapWindowChars(int overlapWindowChars) {
        this.overlapWindowChars = overlapWindowChars;
    }

    public int getTailChars() {
        return tailChars;
    }

    public void setTailChars(int tailChars) {
        this.tailChars = tailChars;
    }

    public int getArchivistInterval() {
        return archivistInterval;
    }

    public void setArchivistInterval(int archivistInterval) {
        this.archivistInterval = archivistInterval;
    }

    public int getDefaultTargetWords() {
        return defaultTargetWords;
    }

    public void setDefaultTargetWords(int defaultTargetWords) {
        this.defaultTargetWords = defaultTargetWords;
    }

    /**
     * Number of beats for a target length: 1 up to the threshold, else 3, or {@code maxBeats} past
     * twice the threshold. Multi-beat scenes always use 3 or 4 beats.
     */
    public int beatsFor(int targetWords) {
        if (targetWords <= beatThresholdWords) {
            return 1;
        }
        return targetWords > 2 * beatThresholdWords ? Math.min(4, Math.max(3, maxBeats)) : 3;
    }
}
