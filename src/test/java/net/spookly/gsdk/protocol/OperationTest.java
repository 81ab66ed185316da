package net.spookly.gsdk.protocol;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class OperationTest {
    @Test
    void mapsRecognizedNames() {
        assertEquals(Operation.CONTINUE, Operation.fromWireName("Continue"));
        assertEquals(Operation.ACTIVE, Operation.fromWireName("Active"));
        assertEquals(Operation.TERMINATE, Operation.fromWireName("Terminate"));
    }

    @Test
    void everythingElseIsUnknown() {
        assertEquals(Operation.UNKNOWN, Operation.fromWireName(null));
        assertEquals(Operation.UNKNOWN, Operation.fromWireName(""));
        assertEquals(Operation.UNKNOWN, Operation.fromWireName("Quarantine"));
        assertEquals(Operation.UNKNOWN, Operation.fromWireName("active"));
    }
}
