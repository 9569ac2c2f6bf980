package com.branchflow.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setRun puts runId and branch in MDC")
    void setRun() {
        MdcContext.setRun("20260314-1", "hotfix/r3-x");
        assertEquals("20260314-1", MDC.get("runId"));
        assertEquals("hotfix/r3-x", MDC.get("branch"));
    }

    @Test
    @DisplayName("setRepository puts repository in MDC")
    void setRepository() {
        MdcContext.setRepository("origin@/srv/app");
        assertEquals("origin@/srv/app", MDC.get("repository"));
    }

    @Test
    @DisplayName("clear removes only Branchflow keys")
    void clear() {
        MDC.put("other", "kept");
        MdcContext.setRun("r", "d7");
        MdcContext.setRepository("x");

        MdcContext.clear();

        assertNull(MDC.get("runId"));
        assertNull(MDC.get("branch"));
        assertNull(MDC.get("repository"));
        assertEquals("kept", MDC.get("other"));
        MDC.remove("other");
    }
}
