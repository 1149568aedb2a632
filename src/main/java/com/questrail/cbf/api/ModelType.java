package com.questrail.cbf.api;

import java.util.Optional;

/**
 * Classes of epoch-scheduled model updates.
 *
 * <p>Each type has its own document key, entry payload key, fleet command and
 * fan-out scope. Delay and Jones updates reach both the channel-input nodes and
 * the function-mode nodes; beam weights only reach the function-mode nodes.</p>
 */
public enum ModelType
{
    DELAY("delayModel", "delayDetails", "UpdateDelayModel", true),
    JONES("jonesMatrix", "matrixDetails", "UpdateJonesMatrix", true),
    BEAM_WEIGHTS("beamWeights", "beamWeightsDetails", "UpdateBeamWeights", false);

    private final String documentKey;
    private final String detailsKey;
    private final String command;
    private final boolean reachesChannelNodes;

    ModelType(String documentKey, String detailsKey, String command, boolean reachesChannelNodes) {
        this.documentKey = documentKey;
        this.detailsKey = detailsKey;
        this.command = command;
        this.reachesChannelNodes = reachesChannelNodes;
    }

    /** Top-level key of the array of entries in a model document. */
    public String documentKey() {
        return documentKey;
    }

    /** Key of the per-entry payload inside each array element. */
    public String detailsKey() {
        return detailsKey;
    }

    /** Fleet command used to apply one entry. */
    public String command() {
        return command;
    }

    public boolean reachesChannelNodes() {
        return reachesChannelNodes;
    }

    public static Optional<ModelType> fromDocumentKey(String key) {
        for (ModelType type : values()) {
            if (type.documentKey.equals(key)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
