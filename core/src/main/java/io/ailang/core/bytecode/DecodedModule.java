package io.ailang.core.bytecode;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/**
 * A validated module ready to execute: the decoded constant pool plus the bounds of the code
 * section inside the original buffer.
 */
final class DecodedModule {

    private final byte[] bytes;
    private final List<JsonNode> constants;
    private final int codeStart;
    private final int codeEnd;

    DecodedModule(byte[] bytes, List<JsonNode> constants, int codeStart, int codeEnd) {
        this.bytes = bytes;
        this.constants = List.copyOf(constants);
        this.codeStart = codeStart;
        this.codeEnd = codeEnd;
    }

    byte[] bytes() {
        return bytes;
    }

    List<JsonNode> constants() {
        return constants;
    }

    /** Offset of the first instruction. */
    int codeStart() {
        return codeStart;
    }

    /** Offset one past the last instruction byte. */
    int codeEnd() {
        return codeEnd;
    }
}
