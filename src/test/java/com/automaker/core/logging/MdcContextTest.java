package com.automaker.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    @DisplayName("setFeature sets project and feature keys")
    void setFeature() {
        MdcContext.setFeature("/p", "F1");

        assertEquals("/p", MDC.get("projectPath"));
        assertEquals("F1", MDC.get("featureId"));
    }

    @Test
    @DisplayName("clearStep leaves the feature keys in place")
    void clearStep() {
        MdcContext.setFeature("/p", "F1");
        MdcContext.setStep("review");
        assertEquals("review", MDC.get("stepId"));

        MdcContext.clearStep();

        assertNull(MDC.get("stepId"));
        assertEquals("F1", MDC.get("featureId"));
    }

    @Test
    @DisplayName("clear removes only the Automaker keys")
    void clear() {
        MDC.put("requestId", "r-1");
        MdcContext.setProject("/p");
        MdcContext.setStep("review");

        MdcContext.clear();

        assertNull(MDC.get("projectPath"));
        assertNull(MDC.get("stepId"));
        assertEquals("r-1", MDC.get("requestId"));
    }
}
