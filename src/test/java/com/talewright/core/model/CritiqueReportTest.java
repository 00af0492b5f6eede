package com.talewright.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CritiqueReportTest {

    private static final double APPROVAL = 8.0;

    private static CritiqueReport report(Double score, Boolean revisionNeeded, Boolean approved) {
        return new CritiqueReport(score, revisionNeeded, approved, null, null, null, null);
    }

    @Test
    @DisplayName("explicit revision_needed wins over the score and the approved flag")
    void explicitFlagWins() {
        Critique critique = report(9.5, true, true).toCritique(APPROVAL);

        assertTrue(critique.revisionNeeded());
        assertFalse(critique.approved());
        assertEquals(9.5, critique.score());
    }

    @Test
    @DisplayName("an approved flag is honoured when revision_needed is absent")
    void approvedFlag() {
        assertFalse(report(3.0, null, true).toCritique(APPROVAL).revisionNeeded());
        assertTrue(report(9.0, null, false).toCritique(APPROVAL).revisionNeeded());
    }

    @Test
    @DisplayName("the score decides when no flag is given")
    void scoreDecides() {
        assertFalse(report(8.0, null, null).toCritique(APPROVAL).revisionNeeded());
        assertTrue(report(7.9, null, null).toCritique(APPROVAL).revisionNeeded());
    }

    @Test
    @DisplayName("an empty critique asks for revision")
    void emptyCritique() {
        Critique critique = report(null, null, null).toCritique(APPROVAL);

        assertTrue(critique.revisionNeeded());
        assertEquals(0.0, critique.score());
        assertTrue(critique.issues().isEmpty());
        assertTrue(critique.revisionRequests().isEmpty());
        assertEquals("", critique.feedback());
    }

    @Test
    @DisplayName("blank list entries are dropped")
    void dropsBlankEntries() {
        CritiqueReport report = new CritiqueReport(6.0, null, null, List.of("mood"),
                Arrays.asList("pacing drags", " ", null), List.of("cut the opening"), "close");

        Critique critique = report.toCritique(APPROVAL);

        assertEquals(List.of("pacing drags"), critique.issues());
        assertEquals(List.of("cut the opening"), critique.revisionRequests());
        assertEquals("close", critique.feedback());
    }
}
