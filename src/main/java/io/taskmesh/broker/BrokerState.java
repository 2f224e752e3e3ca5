package io.taskmesh.broker;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Persistent broker state shared by every client process through one JSON file.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record BrokerState(
        Map<String, ClientInterest> clients,
        BackingProcess.ProcessRef process,
        List<Long> recentStarts
) {
    static BrokerState empty() {
        return new BrokerState(new LinkedHashMap<>(), null, List.of());
    }

    BrokerState normalized() {
        return new BrokerState(
                clients == null ? new LinkedHashMap<>() : new LinkedHashMap<>(clients),
                process,
                recentStarts == null ? List.of() : List.copyOf(recentStarts)
        );
    }

    /**
     * @param pid OS pid of the client, or null when the client did not report one
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record ClientInterest(Long pid, long registeredAtMs, long lastSeenAtMs) {
    }
}
