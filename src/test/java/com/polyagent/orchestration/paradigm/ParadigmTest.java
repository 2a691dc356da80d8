package com.polyagent.orchestration.paradigm;

import com.polyagent.orchestration.CollaborationErrorKind;
import com.polyagent.orchestration.CollaborationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ParadigmTest {

    @Test
    void testFromIdIsCaseInsensitive() {
        assertEquals(Paradigm.ORCHESTRA, Paradigm.fromId("orchestra"));
        assertEquals(Paradigm.MESH, Paradigm.fromId("MESH"));
        assertEquals(Paradigm.ECOSYSTEM, Paradigm.fromId(" Ecosystem "));
    }

    @Test
    void testFromIdRejectsUnknownParadigm() {
        CollaborationException ex = assertThrows(CollaborationException.class, () -> Paradigm.fromId("choir"));
        assertEquals(CollaborationErrorKind.UNKNOWN_PARADIGM, ex.getKind());
        assertFalse(ex.isRetryable());
    }

    @Test
    void testFromIdRejectsBlank() {
        CollaborationException ex = assertThrows(CollaborationException.class, () -> Paradigm.fromId(null));
        assertEquals(CollaborationErrorKind.UNKNOWN_PARADIGM, ex.getKind());
    }

    @Test
    void testEveryParadigmIsDescribed() {
        for (Paradigm paradigm : Paradigm.values()) {
            assertFalse(paradigm.label().isBlank());
            assertFalse(paradigm.description().isBlank());
            assertFalse(paradigm.features().isEmpty());
        }
    }
}
