package com.adlens.agents;

import java.util.UUID;

/** Short random ids for model-produced records that arrive without one. */
final class AgentIds {

    private AgentIds() {
    }

    /** {@code prefix + "_" + 8 hex chars}, e.g. {@code hyp_3f9a1c0e}. */
    static String next(String prefix) {
        return prefix + "_" + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }
}
