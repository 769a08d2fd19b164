package com.typewarden.core.logging;

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
    @DisplayName("setBatch puts batchId in MDC")
    void setBatch() {
        MdcContext.setBatch("batch-1a2b3c4d");
        assertEquals("batch-1a2b3c4d", MDC.get("batchId"));
    }

    @Test
    @DisplayName("setFile puts batchId and filePath in MDC, clearFile removes only the file")
    void setAndClearFile() {
        MdcContext.setFile("batch-1a2b3c4d", "src/a.ts");
        assertEquals("src/a.ts", MDC.get("filePath"));

        MdcContext.clearFile();
        assertNull(MDC.get("filePath"));
        assertEquals("batch-1a2b3c4d", MDC.get("batchId"));
    }

    @Test
    @DisplayName("clear removes all campaign MDC keys")
    void clear() {
        MdcContext.setFile("batch-1a2b3c4d", "src/a.ts");
        MdcContext.setMonitorTick(7);
        assertEquals("7", MDC.get("monitorTick"));

        MdcContext.clear();
        assertNull(MDC.get("batchId"));
        assertNull(MDC.get("filePath"));
        assertNull(MDC.get("monitorTick"));
    }
}
